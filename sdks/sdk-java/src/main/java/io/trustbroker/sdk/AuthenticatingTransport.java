package io.trustbroker.sdk;

import java.io.IOException;
import java.security.PrivateKey;
import java.util.Objects;

/**
 * Stamps every broker call with {@value #CLIENT_ID_HEADER} and, when the call has a body, a
 * {@value #SIGNATURE_HEADER} over exactly the bytes that will be transmitted. Headers are computed
 * per call; nothing is stored on the delegate.
 */
public final class AuthenticatingTransport implements BrokerTransport {
  public static final String CLIENT_ID_HEADER = "Client-Id";
  public static final String SIGNATURE_HEADER = "Signature";

  private final BrokerTransport delegate;
  private final String clientId;
  private final PrivateKey privateKey;

  public AuthenticatingTransport(BrokerTransport delegate, String clientId, PrivateKey privateKey) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.clientId = Objects.requireNonNull(clientId, "clientId");
    this.privateKey = Objects.requireNonNull(privateKey, "privateKey");
  }

  /** @throws SigningException if the body cannot be signed; the delegate is not called */
  @Override
  public TransportResponse send(TransportRequest request) throws IOException, InterruptedException {
    return delegate.send(authenticate(request));
  }

  TransportRequest authenticate(TransportRequest request) {
    TransportRequest authenticated = request.withHeader(CLIENT_ID_HEADER, clientId);
    if (request.hasBody()) {
      authenticated = authenticated.withHeader(SIGNATURE_HEADER, Signatures.sign(privateKey, request.body()));
    }
    return authenticated;
  }
}
