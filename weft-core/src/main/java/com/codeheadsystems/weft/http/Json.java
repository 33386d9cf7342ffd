package com.codeheadsystems.weft.http;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared Jackson mapper. {@link ObjectMapper} is thread-safe once configured.
 */
public final class Json {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private Json() {
  }

  public static ObjectMapper mapper() {
    return MAPPER;
  }
}
