package com.codeheadsystems.weft.session;

import com.codeheadsystems.weft.http.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts between the persisted JSON payload of a {@link SessionRecord} and the in-memory
 * {@link Session}.
 */
public final class SessionCodec {

  /**
   * Serialized form of an empty payload.
   */
  public static final String EMPTY = "{}";

  private static final Logger log = LoggerFactory.getLogger(SessionCodec.class);
  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
  };

  private SessionCodec() {
  }

  /**
   * Builds the request-scoped session for a stored record. A payload that cannot be parsed is
   * replaced by an empty one.
   *
   * @param record the record
   * @return the session
   */
  public static Session toSession(SessionRecord record) {
    return new Session(record.sessionKey(), record.createdAt(), decode(record));
  }

  /**
   * Serializes a session payload.
   *
   * @param session the session
   * @return the JSON payload
   * @throws IllegalArgumentException if a value cannot be serialized
   */
  public static String encode(Session session) {
    try {
      return Json.mapper().writeValueAsString(session.asMap());
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Session data is not serializable", e);
    }
  }

  private static Map<String, Object> decode(SessionRecord record) {
    String data = record.data();
    if (data == null || data.isBlank()) {
      return Map.of();
    }
    try {
      Map<String, Object> map = Json.mapper().readValue(data, MAP_TYPE);
      return map == null ? Map.of() : map;
    } catch (JsonProcessingException e) {
      log.warn("Discarding unreadable payload of session {}: {}",
          SessionKeys.redact(record.sessionKey()), e.getOriginalMessage());
      return Map.of();
    }
  }
}
