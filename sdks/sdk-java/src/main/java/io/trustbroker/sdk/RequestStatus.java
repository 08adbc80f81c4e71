package io.trustbroker.sdk;

public enum RequestStatus {
  INITIATED(false),
  AWAITING_CONSENT(false),
  APPROVED(true),
  DENIED(true),
  EXPIRED(true),
  FAILED(true);

  private final boolean terminal;

  RequestStatus(boolean terminal) {
    this.terminal = terminal;
  }

  public boolean isTerminal() {
    return terminal;
  }

  /** Returns {@code null} for anything outside the known set. */
  public static RequestStatus parse(String value) {
    if (value == null) {
      return null;
    }
    for (RequestStatus status : values()) {
      if (status.name().equals(value)) {
        return status;
      }
    }
    return null;
  }
}
