package com.codeheadsystems.weft.session;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The mutable session payload bound to a request. View code and middleware read and write it
 * directly; changes stay in memory until the session middleware saves them after the response.
 */
public class Session {

  private final String sessionKey;
  private final Instant createdAt;
  private final Map<String, Object> data;
  private boolean modified;
  private boolean invalidated;

  /**
   * Instantiates a new Session.
   *
   * @param sessionKey the session key
   * @param createdAt  the created at
   * @param data       initial payload, copied
   */
  public Session(String sessionKey, Instant createdAt, Map<String, Object> data) {
    this.sessionKey = sessionKey;
    this.createdAt = createdAt;
    this.data = new LinkedHashMap<>(data);
  }

  public String sessionKey() {
    return sessionKey;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Object get(String key) {
    return data.get(key);
  }

  /**
   * Typed lookup.
   *
   * @param <T>  the type
   * @param key  the key
   * @param type expected type of the value
   * @return the value, or empty when absent or of another type
   */
  public <T> Optional<T> get(String key, Class<T> type) {
    Object value = data.get(key);
    return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
  }

  public boolean containsKey(String key) {
    return data.containsKey(key);
  }

  /**
   * Stores a value. Values must be serializable to JSON.
   *
   * @param key   the key
   * @param value the value
   * @return the previous value
   */
  public Object put(String key, Object value) {
    modified = true;
    return data.put(key, value);
  }

  public Object remove(String key) {
    modified = true;
    return data.remove(key);
  }

  public void clear() {
    modified = true;
    data.clear();
  }

  public Set<String> keys() {
    return Collections.unmodifiableSet(data.keySet());
  }

  /**
   * Read-only snapshot of the payload.
   *
   * @return the data
   */
  public Map<String, Object> asMap() {
    return Collections.unmodifiableMap(data);
  }

  public boolean isModified() {
    return modified;
  }

  /**
   * Marks the session for deletion. The session middleware removes it from the store and
   * expires the cookie when the response is sent.
   */
  public void invalidate() {
    invalidated = true;
    data.clear();
  }

  public boolean isInvalidated() {
    return invalidated;
  }
}
