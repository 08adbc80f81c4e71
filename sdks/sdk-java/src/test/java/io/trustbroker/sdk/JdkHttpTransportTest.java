package io.trustbroker.sdk;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JdkHttpTransportTest {
  private static final HttpClient HTTP = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();

  @Test
  void resolvesRelativePathsAgainstBase() {
    JdkHttpTransport transport = new JdkHttpTransport("https://broker.example//", HTTP, null);
    assertEquals("https://broker.example/requests/req-1", transport.resolveUrl("/requests/req-1"));
    assertEquals("https://broker.example/requests", transport.resolveUrl("requests"));
    assertEquals("https://provider.example/data", transport.resolveUrl("https://provider.example/data"));
  }

  @Test
  void relativePathNeedsBase() {
    JdkHttpTransport transport = new JdkHttpTransport(null, HTTP, null);
    assertEquals("http://provider.example/x", transport.resolveUrl("http://provider.example/x"));
    assertThrows(IllegalArgumentException.class, () -> transport.resolveUrl("/requests"));
  }

  @Test
  void sendsHeadersAndBodyVerbatim() throws Exception {
    MockWebServer server = new MockWebServer();
    server.enqueue(new MockResponse().setResponseCode(202).setBody("{\"ok\":true}"));
    server.start();
    try {
      JdkHttpTransport transport = new JdkHttpTransport(server.url("/api").toString(), HTTP, Duration.ofSeconds(5));
      byte[] body = "{\"a\":1}".getBytes(StandardCharsets.UTF_8);

      TransportResponse response = transport.send(TransportRequest.post("/requests", body).withHeader("X-Trace", "t-1"));

      assertEquals(202, response.statusCode());
      assertTrue(response.isSuccess());
      assertEquals("{\"ok\":true}", response.body());

      RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
      assertNotNull(recorded);
      assertEquals("/api/requests", recorded.getPath());
      assertEquals("t-1", recorded.getHeader("X-Trace"));
      assertEquals("application/json", recorded.getHeader("Accept"));
      assertEquals("application/json", recorded.getHeader("Content-Type"));
      assertArrayEquals(body, recorded.getBody().readByteArray());
    } finally {
      server.shutdown();
    }
  }
}
