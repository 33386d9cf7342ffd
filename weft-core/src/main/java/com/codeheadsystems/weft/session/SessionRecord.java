package com.codeheadsystems.weft.session;

import java.time.Duration;
import java.time.Instant;

/**
 * One persisted session row.
 *
 * @param sessionKey unique, unguessable lookup key
 * @param data       JSON-serialized session payload
 * @param createdAt  set at creation, never updated
 * @param lastActive when the session was last saved by a response
 * @param ipAddress  remote address that created the session
 * @param userAgent  user agent that created the session
 */
public record SessionRecord(
    String sessionKey,
    String data,
    Instant createdAt,
    Instant lastActive,
    String ipAddress,
    String userAgent) {

  /**
   * Copy with a new payload and activity time. {@code createdAt} is carried over unchanged.
   *
   * @param newData       the new data
   * @param newLastActive the new last active
   * @return the session record
   */
  public SessionRecord withData(String newData, Instant newLastActive) {
    return new SessionRecord(sessionKey, newData, createdAt, newLastActive, ipAddress, userAgent);
  }

  /**
   * Whether the session has reached the given maximum age.
   *
   * @param now          current time
   * @param maxAgeSecond maximum age in seconds
   * @return true once {@code now - createdAt >= maxAge}
   */
  public boolean isExpired(Instant now, long maxAgeSecond) {
    return Duration.between(createdAt, now).getSeconds() >= maxAgeSecond;
  }
}
