package io.trustbroker.sdk;

/** Missing or unusable credentials while constructing a client. Never retried. */
public class InitializationException extends TrustBrokerException {
  public static final String STATUS = "INITIALIZATION_ERROR";

  public InitializationException(String message) {
    super(STATUS, message);
  }

  public InitializationException(String message, Throwable cause) {
    super(STATUS, message, cause);
  }
}
