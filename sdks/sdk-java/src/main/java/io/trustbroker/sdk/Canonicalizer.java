package io.trustbroker.sdk;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Deterministic JSON serialization used as signing input.
 *
 * <p>Mapping keys are sorted, sequences keep their order and no whitespace is emitted. The
 * output is part of the wire protocol ({@link #VERSION}): any change to number or string
 * formatting invalidates signatures computed by the other side.
 */
public final class Canonicalizer {
  private Canonicalizer() {}

  public static final int VERSION = 1;
  public static final int MAX_DEPTH = 512;

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final char[] HEX = "0123456789abcdef".toCharArray();
  private static final double MAX_SAFE_INTEGER = 9007199254740992d;

  public static CanonicalBytes canonicalize(Object payload) {
    return new CanonicalBytes(canonicalString(payload).getBytes(StandardCharsets.UTF_8));
  }

  public static String canonicalString(Object payload) {
    StringBuilder out = new StringBuilder();
    write(out, payload, 0, Collections.newSetFromMap(new IdentityHashMap<>()));
    return out.toString();
  }

  /**
   * Bytes that get signed for {@code payload}. Text and byte arrays are taken as already
   * serialized and passed through unchanged; anything else is canonicalized.
   */
  public static CanonicalBytes signingInput(Object payload) {
    if (payload instanceof CanonicalBytes) {
      return (CanonicalBytes) payload;
    }
    if (payload instanceof byte[]) {
      return new CanonicalBytes(((byte[]) payload).clone());
    }
    if (payload instanceof CharSequence) {
      return new CanonicalBytes(strictUtf8(payload.toString()));
    }
    return canonicalize(payload);
  }

  private static byte[] strictUtf8(String text) {
    try {
      ByteBuffer encoded = StandardCharsets.UTF_8.newEncoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .encode(CharBuffer.wrap(text));
      byte[] bytes = new byte[encoded.remaining()];
      encoded.get(bytes);
      return bytes;
    } catch (CharacterCodingException e) {
      throw new CanonicalizationException("Text is not valid UTF-16 and cannot be signed as given", e);
    }
  }

  private static void write(StringBuilder out, Object value, int depth, Set<Object> path) {
    if (depth > MAX_DEPTH) {
      throw new CanonicalizationException("Payload nesting exceeds " + MAX_DEPTH + " levels");
    }
    if (value == null) {
      out.append("null");
    } else if (value instanceof CharSequence) {
      writeString(out, value.toString());
    } else if (value instanceof Character) {
      writeString(out, value.toString());
    } else if (value instanceof Boolean) {
      out.append(((Boolean) value).booleanValue() ? "true" : "false");
    } else if (value instanceof Number) {
      out.append(formatNumber((Number) value));
    } else if (value instanceof Enum) {
      writeString(out, ((Enum<?>) value).name());
    } else if (value instanceof JsonNode) {
      write(out, toGenericTree(value), depth, path);
    } else if (value instanceof Map) {
      enter(path, value);
      writeMap(out, (Map<?, ?>) value, depth, path);
      path.remove(value);
    } else if (value instanceof Iterable) {
      enter(path, value);
      List<Object> items = new ArrayList<>();
      for (Object item : (Iterable<?>) value) {
        items.add(item);
      }
      writeSequence(out, items, depth, path);
      path.remove(value);
    } else if (value.getClass().isArray()) {
      enter(path, value);
      writeSequence(out, arrayItems(value), depth, path);
      path.remove(value);
    } else {
      enter(path, value);
      write(out, toGenericTree(value), depth, path);
      path.remove(value);
    }
  }

  private static void writeMap(StringBuilder out, Map<?, ?> map, int depth, Set<Object> path) {
    TreeMap<String, Object> sorted = new TreeMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (entry.getKey() == null) {
        throw new CanonicalizationException("Mapping keys must not be null");
      }
      String key = entry.getKey().toString();
      if (sorted.containsKey(key)) {
        throw new CanonicalizationException("Duplicate mapping key after conversion to text: " + key);
      }
      sorted.put(key, entry.getValue());
    }
    out.append('{');
    boolean first = true;
    for (Map.Entry<String, Object> entry : sorted.entrySet()) {
      if (!first) {
        out.append(',');
      }
      first = false;
      writeString(out, entry.getKey());
      out.append(':');
      write(out, entry.getValue(), depth + 1, path);
    }
    out.append('}');
  }

  private static void writeSequence(StringBuilder out, List<Object> items, int depth, Set<Object> path) {
    out.append('[');
    for (int i = 0; i < items.size(); i++) {
      if (i > 0) {
        out.append(',');
      }
      write(out, items.get(i), depth + 1, path);
    }
    out.append(']');
  }

  private static List<Object> arrayItems(Object array) {
    if (array instanceof Object[]) {
      return Arrays.asList((Object[]) array);
    }
    List<Object> items = new ArrayList<>();
    if (array instanceof int[]) {
      for (int v : (int[]) array) {
        items.add(v);
      }
    } else if (array instanceof long[]) {
      for (long v : (long[]) array) {
        items.add(v);
      }
    } else if (array instanceof double[]) {
      for (double v : (double[]) array) {
        items.add(v);
      }
    } else if (array instanceof float[]) {
      for (float v : (float[]) array) {
        items.add(v);
      }
    } else if (array instanceof short[]) {
      for (short v : (short[]) array) {
        items.add(v);
      }
    } else if (array instanceof byte[]) {
      for (byte v : (byte[]) array) {
        items.add(v);
      }
    } else if (array instanceof char[]) {
      for (char v : (char[]) array) {
        items.add(v);
      }
    } else if (array instanceof boolean[]) {
      for (boolean v : (boolean[]) array) {
        items.add(v);
      }
    }
    return items;
  }

  private static void enter(Set<Object> path, Object container) {
    if (!path.add(container)) {
      throw new CanonicalizationException(
          "Cyclic payload: " + container.getClass().getName() + " contains itself");
    }
  }

  private static Object toGenericTree(Object value) {
    try {
      return MAPPER.convertValue(value, Object.class);
    } catch (JacksonException e) {
      throw new CanonicalizationException(
          "Cannot convert " + value.getClass().getName() + " into a JSON payload", e);
    }
  }

  /**
   * Integral values below 2^53 print without a fraction; everything else prints in plain decimal,
   * never in exponent notation, so {@code 1e21} and {@code 1e-7} differ from JavaScript's output.
   */
  static String formatNumber(Number number) {
    if (number instanceof Integer || number instanceof Long || number instanceof Short ||
        number instanceof Byte || number instanceof BigInteger) {
      return number.toString();
    }
    if (number instanceof BigDecimal) {
      return plain((BigDecimal) number);
    }
    double d = number.doubleValue();
    if (Double.isNaN(d) || Double.isInfinite(d)) {
      throw new CanonicalizationException("Non-finite number cannot be canonicalized: " + number);
    }
    if (d == Math.rint(d) && Math.abs(d) < MAX_SAFE_INTEGER) {
      return Long.toString((long) d);
    }
    // Float widened to double would expose binary noise, so go through its own text form.
    String text = number instanceof Float ? Float.toString(number.floatValue()) : Double.toString(d);
    return plain(new BigDecimal(text));
  }

  private static String plain(BigDecimal value) {
    if (value.signum() == 0) {
      return "0";
    }
    return value.stripTrailingZeros().toPlainString();
  }

  private static void writeString(StringBuilder out, String value) {
    out.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          out.append("\\\"");
          break;
        case '\\':
          out.append("\\\\");
          break;
        case '\b':
          out.append("\\b");
          break;
        case '\f':
          out.append("\\f");
          break;
        case '\n':
          out.append("\\n");
          break;
        case '\r':
          out.append("\\r");
          break;
        case '\t':
          out.append("\\t");
          break;
        default:
          if (c < 0x20 || isLoneSurrogate(value, i)) {
            appendUnicodeEscape(out, c);
          } else {
            out.append(c);
          }
      }
    }
    out.append('"');
  }

  // An unpaired surrogate has no UTF-8 form, so it is written as an escape.
  private static boolean isLoneSurrogate(String value, int i) {
    char c = value.charAt(i);
    if (Character.isHighSurrogate(c)) {
      return i + 1 >= value.length() || !Character.isLowSurrogate(value.charAt(i + 1));
    }
    if (Character.isLowSurrogate(c)) {
      return i == 0 || !Character.isHighSurrogate(value.charAt(i - 1));
    }
    return false;
  }

  private static void appendUnicodeEscape(StringBuilder out, char c) {
    out.append("\\u")
        .append(HEX[(c >> 12) & 0xf])
        .append(HEX[(c >> 8) & 0xf])
        .append(HEX[(c >> 4) & 0xf])
        .append(HEX[c & 0xf]);
  }
}
