package io.trustbroker.sdk;

import java.io.IOException;

/**
 * Sends a request and returns whatever status and body came back. Non-2xx responses are returned,
 * not thrown; an {@link IOException} means no response was received at all.
 *
 * <p>Implementations must be safe to share between threads and must not keep per-call state.
 */
@FunctionalInterface
public interface BrokerTransport {
  TransportResponse send(TransportRequest request) throws IOException, InterruptedException;
}
