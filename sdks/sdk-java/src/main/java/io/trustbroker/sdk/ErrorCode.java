package io.trustbroker.sdk;

public enum ErrorCode {
  API_ERROR,
  PROVIDER_ERROR,
  NETWORK_ERROR,
  ABORTED,
  TIMED_OUT,
  UNKNOWN_STATUS,
  INVALID_RESPONSE,
  DENIED,
  EXPIRED,
  FAILED,
  UNKNOWN
}
