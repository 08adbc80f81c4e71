package io.trustbroker.sdk;

/**
 * Base type for every failure surfaced by the SDK. {@link #getStatus()} is a stable
 * machine-readable code; callers branch on it instead of the message text.
 */
public class TrustBrokerException extends RuntimeException {
  private final String status;

  public TrustBrokerException(String status, String message) {
    super(message);
    this.status = status;
  }

  public TrustBrokerException(String status, String message, Throwable cause) {
    super(message, cause);
    this.status = status;
  }

  public String getStatus() {
    return status;
  }
}
