package io.trustbroker.sdk;

/**
 * The verification key could not be parsed or used. A signature that simply does not match is
 * reported as {@code false} by {@link Signatures#verify}, never with this exception.
 */
public class VerificationException extends TrustBrokerException {
  public static final String STATUS = "VERIFICATION_ERROR";

  public VerificationException(String message) {
    super(STATUS, message);
  }

  public VerificationException(String message, Throwable cause) {
    super(STATUS, message, cause);
  }
}
