package io.trustbroker.sdk;

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;
import java.util.Base64;

/**
 * RSA-SHA256 signatures over {@link Canonicalizer#signingInput} bytes, base64 encoded.
 *
 * <p>{@code verify} answers {@code false} whenever the signature does not match the payload
 * (wrong payload, wrong key, garbled or truncated signature text). It throws
 * {@link VerificationException} only when the key itself is missing, cannot be parsed, or is not
 * usable for RSA verification.
 */
public final class Signatures {
  private Signatures() {}

  public static final String ALGORITHM = "SHA256withRSA";

  public static String sign(PrivateKey privateKey, Object payload) {
    if (privateKey == null) {
      throw new SigningException("Private key is required for signing");
    }
    byte[] input;
    try {
      input = Canonicalizer.signingInput(payload).toByteArray();
    } catch (CanonicalizationException e) {
      throw new SigningException("Payload cannot be canonicalized: " + e.getMessage(), e);
    }
    try {
      Signature signer = Signature.getInstance(ALGORITHM);
      signer.initSign(privateKey);
      signer.update(input);
      return Base64.getEncoder().encodeToString(signer.sign());
    } catch (InvalidKeyException e) {
      throw new SigningException("Private key is not usable for " + ALGORITHM, e);
    } catch (GeneralSecurityException e) {
      throw new SigningException("Failed to sign payload", e);
    }
  }

  public static boolean verify(PublicKey publicKey, Object payload, String signature) {
    if (publicKey == null) {
      throw new VerificationException("Public key is required for verification");
    }
    Signature verifier;
    try {
      verifier = Signature.getInstance(ALGORITHM);
      verifier.initVerify(publicKey);
    } catch (InvalidKeyException e) {
      throw new VerificationException("Public key is not usable for " + ALGORITHM, e);
    } catch (GeneralSecurityException e) {
      throw new VerificationException("Signature algorithm unavailable: " + ALGORITHM, e);
    }

    byte[] signatureBytes = decodeSignature(signature);
    if (signatureBytes == null) {
      return false;
    }
    try {
      verifier.update(Canonicalizer.signingInput(payload).toByteArray());
      return verifier.verify(signatureBytes);
    } catch (SignatureException e) {
      return false;
    }
  }

  public static boolean verify(String publicKeyPem, Object payload, String signature) {
    return verify(parsePublicKey(publicKeyPem), payload, signature);
  }

  static PublicKey parsePublicKey(String publicKeyPem) {
    try {
      return Pem.publicKey(publicKeyPem);
    } catch (IllegalArgumentException e) {
      throw new VerificationException("Public key cannot be parsed: " + e.getMessage(), e);
    }
  }

  private static byte[] decodeSignature(String signature) {
    if (signature == null || signature.trim().isEmpty()) {
      return null;
    }
    try {
      return Base64.getDecoder().decode(signature.trim());
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
