package io.trustbroker.sdk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Broker-side state of one data request, as returned by the status endpoints. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RequestRecord {
  public String requestId;
  public String status;
  public String providerEndpoint;
  public String accessToken;
  public String platformSignature;
  public String failureReason;
}
