package io.trustbroker.sdk;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.cert.CertificateFactory;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads RSA keys from PEM text. PKCS#1 ({@code RSA PRIVATE KEY}, {@code RSA PUBLIC KEY}) blocks
 * are re-wrapped into PKCS#8 / SubjectPublicKeyInfo, which is what the JDK key factory accepts.
 */
final class Pem {
  private Pem() {}

  private static final Pattern BLOCK_PATTERN = Pattern.compile(
      "-----BEGIN ([A-Z0-9 ]+)-----(.*?)-----END \\1-----", Pattern.DOTALL);
  private static final byte[] RSA_ALGORITHM_IDENTIFIER = hex("300d06092a864886f70d0101010500");
  private static final byte[] PKCS8_VERSION = hex("020100");

  static PrivateKey privateKey(String pem) {
    Block block = block(pem, "PRIVATE KEY");
    byte[] pkcs8;
    if ("PRIVATE KEY".equals(block.label)) {
      pkcs8 = block.der;
    } else if ("RSA PRIVATE KEY".equals(block.label)) {
      pkcs8 = der(0x30, concat(PKCS8_VERSION, RSA_ALGORITHM_IDENTIFIER, der(0x04, block.der)));
    } else {
      throw new IllegalArgumentException("Unsupported private key block: " + block.label);
    }
    try {
      return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(pkcs8));
    } catch (Exception e) {
      throw new IllegalArgumentException("Invalid private key", e);
    }
  }

  static PublicKey publicKey(String pem) {
    Block block = block(pem, "PUBLIC KEY");
    try {
      if ("CERTIFICATE".equals(block.label)) {
        CertificateFactory factory = CertificateFactory.getInstance("X.509");
        return factory.generateCertificate(new ByteArrayInputStream(block.der)).getPublicKey();
      }
      byte[] spki;
      if ("PUBLIC KEY".equals(block.label)) {
        spki = block.der;
      } else if ("RSA PUBLIC KEY".equals(block.label)) {
        spki = der(0x30, concat(RSA_ALGORITHM_IDENTIFIER, der(0x03, concat(new byte[] {0}, block.der))));
      } else {
        throw new IllegalArgumentException("Unsupported public key block: " + block.label);
      }
      return KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(spki));
    } catch (IllegalArgumentException e) {
      throw e;
    } catch (Exception e) {
      throw new IllegalArgumentException("Invalid public key", e);
    }
  }

  private static Block block(String pem, String defaultLabel) {
    if (pem == null || pem.trim().isEmpty()) {
      throw new IllegalArgumentException("Key material is empty");
    }
    Matcher matcher = BLOCK_PATTERN.matcher(pem);
    try {
      if (matcher.find()) {
        return new Block(matcher.group(1), Base64.getMimeDecoder().decode(matcher.group(2).trim()));
      }
      // Bare base64 DER without armor.
      return new Block(defaultLabel, Base64.getMimeDecoder().decode(pem.trim()));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Key material is not valid base64", e);
    }
  }

  private static byte[] der(int tag, byte[] content) {
    byte[] length = derLength(content.length);
    byte[] out = new byte[1 + length.length + content.length];
    out[0] = (byte) tag;
    System.arraycopy(length, 0, out, 1, length.length);
    System.arraycopy(content, 0, out, 1 + length.length, content.length);
    return out;
  }

  private static byte[] derLength(int length) {
    if (length < 0x80) {
      return new byte[] {(byte) length};
    }
    int size = 0;
    for (int v = length; v > 0; v >>= 8) {
      size++;
    }
    byte[] out = new byte[1 + size];
    out[0] = (byte) (0x80 | size);
    for (int i = size; i >= 1; i--) {
      out[i] = (byte) (length & 0xff);
      length >>= 8;
    }
    return out;
  }

  private static byte[] concat(byte[]... parts) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (byte[] part : parts) {
      out.write(part, 0, part.length);
    }
    return out.toByteArray();
  }

  private static byte[] hex(String hex) {
    int len = hex.length();
    byte[] out = new byte[len / 2];
    for (int i = 0; i < len; i += 2) {
      out[i / 2] = (byte) Integer.parseInt(hex.substring(i, i + 2), 16);
    }
    return out;
  }

  private static final class Block {
    final String label;
    final byte[] der;

    Block(String label, byte[] der) {
      this.label = label;
      this.der = der;
    }
  }
}
