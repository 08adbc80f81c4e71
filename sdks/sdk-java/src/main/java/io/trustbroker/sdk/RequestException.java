package io.trustbroker.sdk;

/**
 * A broker or provider call did not produce a usable result. {@link #getStatus()} returns the
 * {@link ErrorCode} name, so broker-reported terminal statuses such as {@code DENIED} surface
 * verbatim.
 */
public class RequestException extends TrustBrokerException {
  private final ErrorCode code;
  private final Integer httpStatus;
  private final String requestId;
  private final String failureReason;

  public RequestException(ErrorCode code, String message) {
    this(code, message, null, null, null, null);
  }

  public RequestException(ErrorCode code, String message, Integer httpStatus) {
    this(code, message, httpStatus, null, null, null);
  }

  public RequestException(ErrorCode code, String message, Throwable cause) {
    this(code, message, null, null, null, cause);
  }

  public RequestException(
      ErrorCode code,
      String message,
      Integer httpStatus,
      String requestId,
      String failureReason,
      Throwable cause
  ) {
    super(code.name(), message, cause);
    this.code = code;
    this.httpStatus = httpStatus;
    this.requestId = requestId;
    this.failureReason = failureReason;
  }

  public ErrorCode getCode() {
    return code;
  }

  /** HTTP status of the response that caused this error, or {@code null} if none was received. */
  public Integer getHttpStatus() {
    return httpStatus;
  }

  public String getRequestId() {
    return requestId;
  }

  public String getFailureReason() {
    return failureReason;
  }
}
