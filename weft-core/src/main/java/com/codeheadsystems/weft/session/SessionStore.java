package com.codeheadsystems.weft.session;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage abstraction for sessions.
 * <p>
 * Implementations must be thread-safe. Operations on different session keys must not block
 * each other; concurrent saves of the same key may race, the last write wins.
 * <p>
 * Expiry is evaluated by the caller, not by the store: {@link #load} returns expired rows.
 */
public interface SessionStore {

  /**
   * Loads a session by key.
   *
   * @param sessionKey the session key
   * @return the record, or empty if unknown
   */
  Optional<SessionRecord> load(String sessionKey);

  /**
   * Creates and persists a new, empty session with a fresh key.
   *
   * @param ipAddress remote address of the client
   * @param userAgent user agent of the client
   * @return the new record
   */
  SessionRecord create(String ipAddress, String userAgent);

  /**
   * Stores or replaces the record under its key.
   *
   * @param record the record
   */
  void save(SessionRecord record);

  /**
   * Removes a session, if present.
   *
   * @param sessionKey the session key
   */
  void delete(String sessionKey);

  /**
   * Removes every session created before the cutoff.
   *
   * @param cutoff the cutoff
   * @return number of sessions removed
   */
  int purgeCreatedBefore(Instant cutoff);
}
