package io.trustbroker.sdk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/** {@link BrokerTransport} backed by {@code java.net.http.HttpClient}. */
public final class JdkHttpTransport implements BrokerTransport {
  private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

  private final String baseUrl;
  private final HttpClient httpClient;
  private final Duration requestTimeout;

  /**
   * @param baseUrl prefix for relative paths; {@code null} if only absolute URLs will be sent
   */
  public JdkHttpTransport(String baseUrl, HttpClient httpClient, Duration requestTimeout) {
    this.baseUrl = baseUrl == null ? null : trimRightSlash(baseUrl);
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.requestTimeout = requestTimeout;
  }

  @Override
  public TransportResponse send(TransportRequest request) throws IOException, InterruptedException {
    String url = resolveUrl(request.path());
    HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url));
    if (requestTimeout != null) {
      builder.timeout(requestTimeout);
    }
    for (Map.Entry<String, String> entry : request.headers().entrySet()) {
      builder.header(entry.getKey(), entry.getValue());
    }
    builder.header("Accept", "application/json");
    if (request.hasBody()) {
      if (request.header("Content-Type") == null) {
        builder.header("Content-Type", "application/json");
      }
      builder.method(request.method(), HttpRequest.BodyPublishers.ofByteArray(request.body()));
    } else {
      builder.method(request.method(), HttpRequest.BodyPublishers.noBody());
    }

    log.debug("{} {}", request.method(), url);
    HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    log.debug("{} {} -> {}", request.method(), url, response.statusCode());
    return new TransportResponse(response.statusCode(), response.body());
  }

  String resolveUrl(String path) {
    if (path.startsWith("http://") || path.startsWith("https://")) {
      return path;
    }
    if (baseUrl == null) {
      throw new IllegalArgumentException("Relative path without a base URL: " + path);
    }
    return baseUrl + "/" + trimLeftSlash(path);
  }

  static String trimRightSlash(String value) {
    return value.replaceAll("/+$", "");
  }

  private static String trimLeftSlash(String value) {
    return value.replaceAll("^/+", "");
  }
}
