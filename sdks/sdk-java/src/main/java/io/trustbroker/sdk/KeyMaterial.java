package io.trustbroker.sdk;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * The requester's RSA key pair. The public half is optional and only needed for local
 * verification. Instances are immutable and shared freely between threads.
 */
public final class KeyMaterial {
  private static final byte[] PAIR_CHECK = "trustbroker-key-pair-check".getBytes(StandardCharsets.UTF_8);

  private final PrivateKey privateKey;
  private final PublicKey publicKey;

  private KeyMaterial(PrivateKey privateKey, PublicKey publicKey) {
    this.privateKey = privateKey;
    this.publicKey = publicKey;
  }

  public static KeyMaterial of(PrivateKey privateKey, PublicKey publicKey) {
    if (privateKey == null) {
      throw new InitializationException("Private key is required");
    }
    if (!"RSA".equalsIgnoreCase(privateKey.getAlgorithm())) {
      throw new InitializationException("Unsupported private key algorithm: " + privateKey.getAlgorithm());
    }
    if (publicKey != null) {
      String checkSignature;
      try {
        checkSignature = Signatures.sign(privateKey, PAIR_CHECK);
      } catch (SigningException e) {
        throw new InitializationException("Private key is not usable for signing", e);
      }
      boolean matches;
      try {
        matches = Signatures.verify(publicKey, PAIR_CHECK, checkSignature);
      } catch (VerificationException e) {
        throw new InitializationException("Public key is not usable for verification", e);
      }
      if (!matches) {
        throw new InitializationException("Private key does not match public key");
      }
    }
    return new KeyMaterial(privateKey, publicKey);
  }

  public static KeyMaterial of(KeyPair keyPair) {
    return of(keyPair.getPrivate(), keyPair.getPublic());
  }

  public static KeyMaterial fromPem(String privateKeyPem) {
    return fromPem(privateKeyPem, null);
  }

  public static KeyMaterial fromPem(String privateKeyPem, String publicKeyPem) {
    PrivateKey privateKey;
    try {
      privateKey = Pem.privateKey(privateKeyPem);
    } catch (IllegalArgumentException e) {
      throw new InitializationException("Invalid private key: " + e.getMessage(), e);
    }
    PublicKey publicKey = null;
    if (publicKeyPem != null && !publicKeyPem.trim().isEmpty()) {
      try {
        publicKey = Pem.publicKey(publicKeyPem);
      } catch (IllegalArgumentException e) {
        throw new InitializationException("Invalid public key: " + e.getMessage(), e);
      }
    }
    return of(privateKey, publicKey);
  }

  public PrivateKey privateKey() {
    return privateKey;
  }

  /** May be {@code null} when only signing was configured. */
  public PublicKey publicKey() {
    return publicKey;
  }

  public boolean hasPublicKey() {
    return publicKey != null;
  }
}
