package io.trustbroker.sdk;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * One outbound call. Immutable: {@link #withHeader} returns a copy, so decorating a request never
 * changes what the caller holds.
 */
public final class TransportRequest {
  private final String method;
  private final String path;
  private final Map<String, String> headers;
  private final byte[] body;

  private TransportRequest(String method, String path, Map<String, String> headers, byte[] body) {
    this.method = method;
    this.path = path;
    this.headers = Collections.unmodifiableMap(headers);
    this.body = body;
  }

  public static TransportRequest get(String path) {
    return new TransportRequest("GET", requirePath(path), new LinkedHashMap<>(), null);
  }

  public static TransportRequest post(String path, byte[] body) {
    return new TransportRequest("POST", requirePath(path), new LinkedHashMap<>(), body == null ? null : body.clone());
  }

  public TransportRequest withHeader(String name, String value) {
    Map<String, String> copy = new LinkedHashMap<>(headers);
    copy.put(name, value);
    return new TransportRequest(method, path, copy, body);
  }

  public String method() {
    return method;
  }

  /** Path relative to the transport's base URL, or an absolute http(s) URL. */
  public String path() {
    return path;
  }

  public Map<String, String> headers() {
    return headers;
  }

  public String header(String name) {
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      if (entry.getKey().toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT))) {
        return entry.getValue();
      }
    }
    return null;
  }

  public boolean hasBody() {
    return body != null && body.length > 0;
  }

  /** Copy of the body, or {@code null} for calls without one. */
  public byte[] body() {
    return body == null ? null : body.clone();
  }

  private static String requirePath(String path) {
    if (path == null || path.trim().isEmpty()) {
      throw new IllegalArgumentException("request path is required");
    }
    return path;
  }
}
