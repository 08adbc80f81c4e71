package io.trustbroker.sdk;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * How the requester proves to the provider that consent was granted. The mode also decides which
 * status endpoint is polled and which deliverables an {@code APPROVED} record must carry.
 */
public enum ProviderAuthMode {
  /** {@code Authorization: Bearer <accessToken>}; polls {@code /requests/{id}/token}. */
  BEARER_TOKEN,
  /** Signed body carrying the broker's platform signature; polls {@code /requests/{id}}. */
  SIGNED_BODY;

  String statusPath(String requestId) {
    String base = "/requests/" + urlEncode(requestId);
    return this == BEARER_TOKEN ? base + "/token" : base;
  }

  /** Name of the first deliverable missing from an approved record, or {@code null}. */
  String missingDeliverable(RequestRecord record) {
    if (isBlank(record.providerEndpoint)) {
      return "providerEndpoint";
    }
    if (this == BEARER_TOKEN && isBlank(record.accessToken)) {
      return "accessToken";
    }
    if (this == SIGNED_BODY && isBlank(record.platformSignature)) {
      return "platformSignature";
    }
    return null;
  }

  static String urlEncode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }

  private static boolean isBlank(String value) {
    return value == null || value.trim().isEmpty();
  }
}
