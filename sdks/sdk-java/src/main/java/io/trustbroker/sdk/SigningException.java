package io.trustbroker.sdk;

public class SigningException extends TrustBrokerException {
  public static final String STATUS = "SIGNING_ERROR";

  public SigningException(String message) {
    super(STATUS, message);
  }

  public SigningException(String message, Throwable cause) {
    super(STATUS, message, cause);
  }
}
