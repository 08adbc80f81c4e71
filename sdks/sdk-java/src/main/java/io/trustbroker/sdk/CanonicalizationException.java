package io.trustbroker.sdk;

/** The payload cannot be turned into canonical form (cycle, excessive depth, non-finite number). */
public class CanonicalizationException extends IllegalArgumentException {
  public CanonicalizationException(String message) {
    super(message);
  }

  public CanonicalizationException(String message, Throwable cause) {
    super(message, cause);
  }
}
