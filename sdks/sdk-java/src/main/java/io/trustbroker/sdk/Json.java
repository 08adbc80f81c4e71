package io.trustbroker.sdk;

import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.util.function.Function;

final class Json {
  private Json() {}

  static final ObjectMapper MAPPER = new ObjectMapper();

  /** Decodes a successful response body; anything undecodable is the server's contract violation. */
  static <T> T decode(String context, TransportResponse response, Class<T> type) {
    return read(context, response, body -> MAPPER.readValue(body, type));
  }

  static <T> T decode(String context, TransportResponse response, TypeReference<T> type) {
    return read(context, response, body -> MAPPER.readValue(body, type));
  }

  private static <T> T read(String context, TransportResponse response, Function<String, T> reader) {
    if (response.body().trim().isEmpty()) {
      throw new RequestException(ErrorCode.INVALID_RESPONSE, context + ": empty response body",
          response.statusCode());
    }
    T value;
    try {
      value = reader.apply(response.body());
    } catch (JacksonException e) {
      throw new RequestException(ErrorCode.INVALID_RESPONSE, context + ": malformed response body",
          response.statusCode(), null, null, e);
    }
    if (value == null) {
      throw new RequestException(ErrorCode.INVALID_RESPONSE, context + ": null response body",
          response.statusCode());
    }
    return value;
  }
}
