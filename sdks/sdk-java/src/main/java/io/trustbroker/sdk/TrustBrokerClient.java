package io.trustbroker.sdk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import tools.jackson.core.type.TypeReference;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Requester-side client for the Trust Broker.
 *
 * <p>Broker calls are authenticated by {@link AuthenticatingTransport}: every call carries
 * {@code Client-Id}, and calls with a body carry a {@code Signature} over the canonical body that
 * is sent. Provider calls go straight to the endpoint the broker handed out.
 *
 * <p>Every method either returns a value or throws a {@link TrustBrokerException}; transport
 * exceptions never escape unclassified. Instances are thread-safe.
 */
public final class TrustBrokerClient {
  public static final String DEFAULT_BROKER_URL = "https://broker.trustbroker.io";
  public static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

  private static final TypeReference<Map<String, Object>> INSTITUTION =
      new TypeReference<Map<String, Object>>() {};

  private final String clientId;
  private final KeyMaterial keys;
  private final String brokerUrl;
  private final Duration pollingInterval;
  private final Duration pollingTimeout;
  private final ProviderAuthMode providerAuthMode;
  private final ClientLogger logger;
  private final BrokerTransport broker;
  private final BrokerTransport provider;
  private final ConsentPoller poller;

  public TrustBrokerClient(ClientOptions options) {
    if (options == null) {
      throw new InitializationException("Client options are required");
    }
    if (ClientOptions.isBlank(options.clientId)) {
      throw new InitializationException("Missing credentials: client id is required");
    }
    if (options.keyMaterial == null && ClientOptions.isBlank(options.privateKeyPem)) {
      throw new InitializationException("Missing credentials: private key is required");
    }

    this.clientId = options.clientId.trim();
    this.keys = options.keyMaterial != null
        ? options.keyMaterial
        : KeyMaterial.fromPem(options.privateKeyPem, options.publicKeyPem);
    this.brokerUrl = resolveBrokerUrl(options.brokerUrl);
    this.pollingInterval = optionMillis("pollingIntervalMs", options.pollingIntervalMs, ConsentPoller.DEFAULT_INTERVAL);
    this.pollingTimeout = optionMillis("pollingTimeoutMs", options.pollingTimeoutMs, ConsentPoller.DEFAULT_TIMEOUT);
    Duration requestTimeout = optionMillis("requestTimeoutMs", options.requestTimeoutMs, DEFAULT_REQUEST_TIMEOUT);
    this.providerAuthMode = options.providerAuthMode != null ? options.providerAuthMode : ProviderAuthMode.BEARER_TOKEN;
    this.logger = options.logger != null ? options.logger : ClientLogger.NOOP;

    HttpClient httpClient = options.httpClient != null
        ? options.httpClient
        : HttpClient.newBuilder().connectTimeout(requestTimeout).build();
    BrokerTransport brokerHttp = options.brokerTransport != null
        ? options.brokerTransport
        : new JdkHttpTransport(brokerUrl, httpClient, requestTimeout);
    this.broker = new AuthenticatingTransport(brokerHttp, clientId, keys.privateKey());
    this.provider = options.providerTransport != null
        ? options.providerTransport
        : new JdkHttpTransport(null, httpClient, requestTimeout);
    this.poller = new ConsentPoller(broker, providerAuthMode, logger);
  }

  public static TrustBrokerClient fromEnvironment() {
    return new TrustBrokerClient(ClientOptions.fromEnvironment());
  }

  public String getClientId() {
    return clientId;
  }

  public String getBrokerUrl() {
    return brokerUrl;
  }

  public ProviderAuthMode getProviderAuthMode() {
    return providerAuthMode;
  }

  public Map<String, Object> getMyInstitution() {
    return brokerGet("getMyInstitution", "/institution/me", INSTITUTION);
  }

  public Map<String, Object> getInstitutionById(String id) {
    requireText("id", id);
    return brokerGet("getInstitutionById", "/institution/" + ProviderAuthMode.urlEncode(id), INSTITUTION);
  }

  /** The broker's platform public key, as PEM text. */
  public String getPublicKey() {
    String context = "getPublicKey";
    TransportResponse response = send(context, broker, TransportRequest.get("/system/public-key"));
    if (!response.isSuccess()) {
      throw ErrorClassifier.apiError(context, response);
    }
    String body = response.body().trim();
    if (body.startsWith("\"")) {
      return Json.decode(context, response, String.class);
    }
    if (body.startsWith("{")) {
      PublicKeyBody parsed = Json.decode(context, response, PublicKeyBody.class);
      if (ClientOptions.isBlank(parsed.publicKey)) {
        throw ErrorClassifier.invalidResponse(context, null, "publicKey is missing");
      }
      return parsed.publicKey;
    }
    if (body.isEmpty()) {
      throw ErrorClassifier.invalidResponse(context, null, "empty response body");
    }
    return body;
  }

  public CreateDataRequestResult createDataRequest(CreateDataRequestParams params) {
    String context = "createDataRequest";
    if (params == null) {
      throw new IllegalArgumentException("params are required");
    }
    requireText("providerId", params.providerId);
    requireText("dataOwnerId", params.dataOwnerId);
    requireText("schemaId", params.schemaId);

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("providerId", params.providerId);
    payload.put("dataOwnerId", params.dataOwnerId);
    payload.put("schemaId", params.schemaId);
    payload.put("expiresIn", params.expiresIn != null ? params.expiresIn : DEFAULT_EXPIRES_IN_SECONDS);

    CreateDataRequestResult result = brokerPost(context, "/requests", payload, CreateDataRequestResult.class);
    if (ClientOptions.isBlank(result.requestId)) {
      throw ErrorClassifier.invalidResponse(context, null, "requestId is missing");
    }
    logger.info(context + ": created request " + result.requestId + " (" + result.status + ")");
    return result;
  }

  public RequestRecord getRequestStatus(String requestId) {
    requireText("requestId", requestId);
    return brokerGet("getRequestStatus", ProviderAuthMode.SIGNED_BODY.statusPath(requestId), RequestRecord.class);
  }

  public RequestRecord getRequestToken(String requestId) {
    requireText("requestId", requestId);
    return brokerGet("getRequestToken", ProviderAuthMode.BEARER_TOKEN.statusPath(requestId), RequestRecord.class);
  }

  public RequestRecord pollForConsent(String requestId) {
    return pollForConsent(requestId, null);
  }

  public RequestRecord pollForConsent(String requestId, PollOptions options) {
    PollOptions effective = options != null ? options : new PollOptions();
    Duration interval = positiveMillis("intervalMs", effective.intervalMs, pollingInterval);
    Duration timeout = positiveMillis("timeoutMs", effective.timeoutMs, pollingTimeout);
    return poller.poll(requestId, interval, timeout, effective.cancellation, effective.listener);
  }

  /** Bearer-token retrieval from the provider. */
  public ProviderDataResponse fetchFromProvider(String providerEndpoint, String accessToken, String requestId) {
    requireText("providerEndpoint", providerEndpoint);
    requireText("accessToken", accessToken);
    requireText("requestId", requestId);

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("requestId", requestId);
    body.put("requesterId", clientId);
    TransportRequest request = TransportRequest.post(providerEndpoint, Canonicalizer.canonicalize(body).toByteArray())
        .withHeader("Authorization", "Bearer " + accessToken);
    return providerCall("fetchFromProvider", request);
  }

  /** Signed-body retrieval from the provider, presenting the broker's platform signature. */
  public ProviderDataResponse requestDataFromProvider(
      String requestId,
      String platformSignature,
      String requesterSignature,
      String providerEndpoint
  ) {
    requireText("requestId", requestId);
    requireText("platformSignature", platformSignature);
    requireText("requesterSignature", requesterSignature);
    requireText("providerEndpoint", providerEndpoint);

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("requesterId", clientId);
    body.put("platformSignature", platformSignature);
    body.put("requestId", requestId);
    body.put("signature", requesterSignature);
    TransportRequest request = TransportRequest.post(providerEndpoint, Canonicalizer.canonicalize(body).toByteArray());
    return providerCall("requestDataFromProvider", request);
  }

  public CompleteRequestResponse submitRequesterSignature(
      String requestId,
      String providerId,
      String providerSignature,
      String platformSignature,
      String requesterSignature
  ) {
    requireText("requestId", requestId);
    requireText("providerId", providerId);
    requireText("providerSignature", providerSignature);
    requireText("platformSignature", platformSignature);
    requireText("requesterSignature", requesterSignature);

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("providerId", providerId);
    payload.put("providerSignature", providerSignature);
    payload.put("platformSignature", platformSignature);
    payload.put("requesterSignature", requesterSignature);
    return brokerPost("submitRequesterSignature",
        "/requests/" + ProviderAuthMode.urlEncode(requestId) + "/requester-signature", payload,
        CompleteRequestResponse.class);
  }

  /**
   * Creates a request, waits for consent and fetches the data from the provider using the
   * configured {@link ProviderAuthMode}.
   */
  public ProviderDataResponse requestData(RequestDataParams params) {
    String context = "requestData";
    if (params == null) {
      throw new IllegalArgumentException("params are required");
    }

    CreateDataRequestParams create = new CreateDataRequestParams();
    create.providerId = params.providerId;
    create.dataOwnerId = params.ownerExternalId;
    create.schemaId = params.schemaId;
    create.expiresIn = params.expiresIn;
    CreateDataRequestResult created = createDataRequest(create);

    PollOptions poll = new PollOptions();
    poll.intervalMs = params.pollingIntervalMs;
    poll.timeoutMs = params.timeoutMs;
    poll.cancellation = params.cancellation;
    poll.listener = params.listener;
    RequestRecord approved = pollForConsent(created.requestId, poll);
    requireHttpUrl(context, created.requestId, approved.providerEndpoint);

    if (providerAuthMode == ProviderAuthMode.BEARER_TOKEN) {
      return fetchFromProvider(approved.providerEndpoint, approved.accessToken, created.requestId);
    }
    Map<String, Object> claims = new LinkedHashMap<>();
    claims.put("platformSignature", approved.platformSignature);
    claims.put("requestId", created.requestId);
    claims.put("requesterId", clientId);
    String requesterSignature = signPayload(claims);
    return requestDataFromProvider(created.requestId, approved.platformSignature, requesterSignature,
        approved.providerEndpoint);
  }

  /** Signs {@code payload} with the client's private key; text and bytes are signed as given. */
  public String signPayload(Object payload) {
    return Signatures.sign(keys.privateKey(), payload);
  }

  public boolean verifyPayloadSignature(Object payload, String signature, String publicKeyPem) {
    return Signatures.verify(publicKeyPem, payload, signature);
  }

  /** Verifies against the public key this client was configured with. */
  public boolean verifyPayloadSignature(Object payload, String signature) {
    if (!keys.hasPublicKey()) {
      throw new VerificationException("No public key configured for this client");
    }
    return Signatures.verify(keys.publicKey(), payload, signature);
  }

  private <T> T brokerGet(String context, String path, Class<T> type) {
    return Json.decode(context, brokerGetResponse(context, path), type);
  }

  private <T> T brokerGet(String context, String path, TypeReference<T> type) {
    return Json.decode(context, brokerGetResponse(context, path), type);
  }

  private TransportResponse brokerGetResponse(String context, String path) {
    logger.debug(context + ": GET " + path);
    TransportResponse response = send(context, broker, TransportRequest.get(path));
    if (!response.isSuccess()) {
      throw ErrorClassifier.apiError(context, response);
    }
    return response;
  }

  private <T> T brokerPost(String context, String path, Map<String, Object> payload, Class<T> type) {
    logger.debug(context + ": POST " + path);
    byte[] body = Canonicalizer.canonicalize(payload).toByteArray();
    TransportResponse response = send(context, broker, TransportRequest.post(path, body));
    if (!response.isSuccess()) {
      throw ErrorClassifier.apiError(context, response);
    }
    return Json.decode(context, response, type);
  }

  private ProviderDataResponse providerCall(String context, TransportRequest request) {
    logger.debug(context + ": POST " + request.path());
    TransportResponse response = send(context, provider, request);
    if (!response.isSuccess()) {
      throw ErrorClassifier.providerError(context, response);
    }
    return Json.decode(context, response, ProviderDataResponse.class);
  }

  private TransportResponse send(String context, BrokerTransport transport, TransportRequest request) {
    try {
      return transport.send(request);
    } catch (IOException | UncheckedIOException e) {
      logger.error(context + ": request failed", e);
      throw ErrorClassifier.network(context, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw ErrorClassifier.aborted(context, null, e);
    } catch (TrustBrokerException e) {
      throw e;
    } catch (RuntimeException e) {
      logger.error(context + ": transport failed unexpectedly", e);
      throw ErrorClassifier.unexpected(context, e);
    }
  }

  private static void requireHttpUrl(String context, String requestId, String url) {
    String problem = "providerEndpoint is not an http(s) URL: " + url;
    URI uri;
    try {
      uri = URI.create(url);
    } catch (IllegalArgumentException e) {
      throw new RequestException(ErrorCode.INVALID_RESPONSE, context + ": " + problem, null, requestId, null, e);
    }
    String scheme = uri.getScheme();
    if (uri.getHost() == null || !("https".equalsIgnoreCase(scheme) || "http".equalsIgnoreCase(scheme))) {
      throw ErrorClassifier.invalidResponse(context, requestId, problem);
    }
  }

  private static String resolveBrokerUrl(String explicit) {
    String value = ClientOptions.isBlank(explicit) ? DEFAULT_BROKER_URL : explicit.trim();
    try {
      URI uri = URI.create(value);
      if (uri.getScheme() == null || uri.getHost() == null) {
        throw new InitializationException("Broker URL must be absolute: " + value);
      }
    } catch (IllegalArgumentException e) {
      throw new InitializationException("Invalid broker URL: " + value, e);
    }
    return JdkHttpTransport.trimRightSlash(value);
  }

  private static Duration optionMillis(String name, Long value, Duration fallback) {
    try {
      return positiveMillis(name, value, fallback);
    } catch (IllegalArgumentException e) {
      throw new InitializationException(e.getMessage(), e);
    }
  }

  private static Duration positiveMillis(String name, Long value, Duration fallback) {
    if (value == null) {
      return fallback;
    }
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be positive: " + value);
    }
    return Duration.ofMillis(value);
  }

  private static void requireText(String name, String value) {
    if (ClientOptions.isBlank(value)) {
      throw new IllegalArgumentException(name + " is required");
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static class PublicKeyBody {
    public String publicKey;
  }

  public static class CreateDataRequestParams {
    public String providerId;
    public String dataOwnerId;
    public String schemaId;
    public Long expiresIn;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class CreateDataRequestResult {
    public String requestId;
    public String status;
  }

  public static class PollOptions {
    public Long intervalMs;
    public Long timeoutMs;
    public CancellationToken cancellation;
    public StatusListener listener;
  }

  public static class RequestDataParams {
    public String ownerExternalId;
    public String providerId;
    public String schemaId;
    public Long expiresIn;
    public Long pollingIntervalMs;
    public Long timeoutMs;
    public CancellationToken cancellation;
    public StatusListener listener;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ProviderDataResponse {
    public String signature;
    public String requestId;
    public Object data;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class CompleteRequestResponse {
    public String requestId;
    public String status;
  }
}
