package io.trustbroker.sdk;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/** Immutable output of {@link Canonicalizer}. */
public final class CanonicalBytes {
  private final byte[] bytes;

  CanonicalBytes(byte[] bytes) {
    this.bytes = bytes;
  }

  public byte[] toByteArray() {
    return bytes.clone();
  }

  public int length() {
    return bytes.length;
  }

  public String asString() {
    return new String(bytes, StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof CanonicalBytes)) {
      return false;
    }
    return Arrays.equals(bytes, ((CanonicalBytes) other).bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return asString();
  }
}
