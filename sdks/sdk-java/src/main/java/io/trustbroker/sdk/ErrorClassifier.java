package io.trustbroker.sdk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import tools.jackson.core.JacksonException;

/**
 * Turns transport outcomes into {@link RequestException}s. Connectivity failures and 5xx responses
 * are transient; every other non-2xx response is final.
 */
public final class ErrorClassifier {
  private ErrorClassifier() {}

  public static boolean isTransient(TransportResponse response) {
    return response.statusCode() >= 500;
  }

  public static RequestException apiError(String context, TransportResponse response) {
    return fromResponse(ErrorCode.API_ERROR, context, response);
  }

  public static RequestException providerError(String context, TransportResponse response) {
    return fromResponse(ErrorCode.PROVIDER_ERROR, context, response);
  }

  public static RequestException fromResponse(ErrorCode code, String context, TransportResponse response) {
    return new RequestException(code, context + ": " + errorMessage(response), response.statusCode());
  }

  public static RequestException network(String context, Exception cause) {
    return new RequestException(ErrorCode.NETWORK_ERROR, context + ": " + cause.getMessage(), cause);
  }

  /** A transport failed in a way that is neither a connectivity problem nor an HTTP response. */
  public static RequestException unexpected(String context, RuntimeException cause) {
    return new RequestException(ErrorCode.UNKNOWN, context + ": " + cause, cause);
  }

  public static RequestException aborted(String context, String requestId, Throwable cause) {
    return new RequestException(ErrorCode.ABORTED, context + ": aborted", null, requestId, null, cause);
  }

  public static RequestException timedOut(String context, String requestId, long timeoutMs) {
    return new RequestException(ErrorCode.TIMED_OUT,
        context + ": no terminal status within " + timeoutMs + " ms", null, requestId, null, null);
  }

  public static RequestException invalidResponse(String context, String requestId, String detail) {
    return new RequestException(ErrorCode.INVALID_RESPONSE, context + ": " + detail, null, requestId, null, null);
  }

  public static RequestException unknownStatus(String context, String requestId, String status) {
    return new RequestException(ErrorCode.UNKNOWN_STATUS,
        context + ": unrecognized status '" + status + "'", null, requestId, null, null);
  }

  /** DENIED, EXPIRED and FAILED records become errors whose code is the status itself. */
  public static RequestException terminal(String context, RequestRecord record) {
    ErrorCode code = ErrorCode.valueOf(record.status);
    String message = context + ": request " + record.requestId + " " + record.status;
    if (record.failureReason != null && !record.failureReason.isEmpty()) {
      message += " (" + record.failureReason + ")";
    }
    return new RequestException(code, message, null, record.requestId, record.failureReason, null);
  }

  /** The body's {@code error} (or {@code message}) field, else a generic status line. */
  static String errorMessage(TransportResponse response) {
    String fallback = "Request failed with status code " + response.statusCode();
    String body = response.body().trim();
    if (!body.startsWith("{")) {
      return fallback;
    }
    try {
      ErrorBody parsed = Json.MAPPER.readValue(body, ErrorBody.class);
      if (parsed.error instanceof String && !((String) parsed.error).isEmpty()) {
        return (String) parsed.error;
      }
      if (parsed.error != null) {
        return Json.MAPPER.writeValueAsString(parsed.error);
      }
      if (parsed.message != null && !parsed.message.isEmpty()) {
        return parsed.message;
      }
      return fallback;
    } catch (JacksonException e) {
      return fallback;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static class ErrorBody {
    public Object error;
    public String message;
  }
}
