package io.trustbroker.sdk;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Replays canned broker responses in order and records every request it receives. */
final class ScriptedTransport implements BrokerTransport {
  interface Reply {
    TransportResponse reply(TransportRequest request) throws IOException, InterruptedException;
  }

  private final Deque<Reply> replies = new ArrayDeque<>();
  private Reply fallback;
  final List<TransportRequest> requests = new CopyOnWriteArrayList<>();

  ScriptedTransport respond(int status, String body) {
    replies.add(request -> new TransportResponse(status, body));
    return this;
  }

  ScriptedTransport respondTimes(int times, int status, String body) {
    for (int i = 0; i < times; i++) {
      respond(status, body);
    }
    return this;
  }

  ScriptedTransport fail(IOException error) {
    replies.add(request -> {
      throw error;
    });
    return this;
  }

  ScriptedTransport thenAlways(int status, String body) {
    fallback = request -> new TransportResponse(status, body);
    return this;
  }

  int queries() {
    return requests.size();
  }

  @Override
  public synchronized TransportResponse send(TransportRequest request) throws IOException, InterruptedException {
    requests.add(request);
    Reply next = replies.poll();
    if (next == null) {
      next = fallback;
    }
    if (next == null) {
      throw new AssertionError("Unexpected request " + request.method() + " " + request.path());
    }
    return next.reply(request);
  }

  static String record(String status) {
    return "{\"requestId\":\"req-1\",\"status\":\"" + status + "\"}";
  }

  static String approved(String providerEndpoint, String accessToken) {
    return "{\"requestId\":\"req-1\",\"status\":\"APPROVED\",\"providerEndpoint\":\"" + providerEndpoint +
        "\",\"accessToken\":\"" + accessToken + "\"}";
  }
}
