package io.trustbroker.sdk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * Settings for {@link TrustBrokerClient}. Either {@link #keyMaterial} or {@link #privateKeyPem}
 * must be set; everything else has a default.
 */
public class ClientOptions {
  private static final Logger log = LoggerFactory.getLogger(ClientOptions.class);

  public static final String ENV_CLIENT_ID = "TB_CLIENT_ID";
  public static final String ENV_PRIVATE_KEY = "TB_PRIVATE_KEY";
  public static final String ENV_PUBLIC_KEY = "TB_PUBLIC_KEY";
  public static final String ENV_BROKER_URL = "TB_BROKER_URL";
  public static final String ENV_POLL_INTERVAL_MS = "TB_POLL_INTERVAL_MS";
  public static final String ENV_POLL_TIMEOUT_MS = "TB_POLL_TIMEOUT_MS";

  public String clientId;
  public KeyMaterial keyMaterial;
  public String privateKeyPem;
  public String publicKeyPem;
  public String brokerUrl;
  public Long pollingIntervalMs;
  public Long pollingTimeoutMs;
  public Long requestTimeoutMs;
  public ProviderAuthMode providerAuthMode;
  public ClientLogger logger;
  /** Replaces the HTTP transport used for broker calls; still wrapped for authentication. */
  public BrokerTransport brokerTransport;
  /** Replaces the HTTP transport used for provider calls. */
  public BrokerTransport providerTransport;
  public HttpClient httpClient;

  public static ClientOptions fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Reads credentials and settings from {@code TB_*} variables. {@code TB_PRIVATE_KEY} and
   * {@code TB_PUBLIC_KEY} hold either PEM text or base64 of PEM text.
   */
  public static ClientOptions fromEnvironment(Map<String, String> env) {
    String clientId = env.get(ENV_CLIENT_ID);
    String privateKey = env.get(ENV_PRIVATE_KEY);
    if (isBlank(clientId) || isBlank(privateKey)) {
      throw new InitializationException(
          "Missing credentials: " + ENV_CLIENT_ID + " and " + ENV_PRIVATE_KEY + " are required");
    }

    ClientOptions options = new ClientOptions();
    options.clientId = clientId.trim();
    options.privateKeyPem = pemText(ENV_PRIVATE_KEY, privateKey);
    if (!isBlank(env.get(ENV_PUBLIC_KEY))) {
      options.publicKeyPem = pemText(ENV_PUBLIC_KEY, env.get(ENV_PUBLIC_KEY));
    }
    if (!isBlank(env.get(ENV_BROKER_URL))) {
      options.brokerUrl = env.get(ENV_BROKER_URL).trim();
    }
    options.pollingIntervalMs = parseMillis(ENV_POLL_INTERVAL_MS, env.get(ENV_POLL_INTERVAL_MS));
    options.pollingTimeoutMs = parseMillis(ENV_POLL_TIMEOUT_MS, env.get(ENV_POLL_TIMEOUT_MS));

    log.debug("Loaded client options for {} (broker {}, public key {})", options.clientId,
        options.brokerUrl != null ? options.brokerUrl : "default",
        options.publicKeyPem != null ? "present" : "absent");
    return options;
  }

  private static String pemText(String name, String value) {
    String trimmed = value.trim();
    if (trimmed.contains("-----BEGIN ")) {
      return trimmed;
    }
    try {
      return new String(Base64.getMimeDecoder().decode(trimmed), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      throw new InitializationException(name + " is neither PEM nor base64-encoded PEM", e);
    }
  }

  private static Long parseMillis(String name, String value) {
    if (isBlank(value)) {
      return null;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new InitializationException(name + " must be a number of milliseconds: " + value, e);
    }
  }

  static boolean isBlank(String value) {
    return value == null || value.trim().isEmpty();
  }
}
