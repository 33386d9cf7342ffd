package com.codeheadsystems.weft.session;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All sessions are lost on restart. Suitable for development and testing only.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final ConcurrentHashMap<String, SessionRecord> store = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemorySessionStore() {
    this(Clock.systemUTC());
  }

  /**
   * Instantiates a new In memory session store.
   *
   * @param clock source of creation times
   */
  public InMemorySessionStore(Clock clock) {
    this.clock = clock;
    log.warn("Using InMemorySessionStore: sessions will NOT survive restarts. "
        + "Replace with a persistent SessionStore for production.");
  }

  @Override
  public Optional<SessionRecord> load(String sessionKey) {
    if (sessionKey == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(store.get(sessionKey));
  }

  @Override
  public SessionRecord create(String ipAddress, String userAgent) {
    Instant now = clock.instant();
    while (true) {
      SessionRecord record = new SessionRecord(SessionKeys.generate(), SessionCodec.EMPTY,
          now, now, ipAddress, userAgent);
      if (store.putIfAbsent(record.sessionKey(), record) == null) {
        log.debug("Created session {}", SessionKeys.redact(record.sessionKey()));
        return record;
      }
    }
  }

  @Override
  public void save(SessionRecord record) {
    store.put(record.sessionKey(), record);
  }

  @Override
  public void delete(String sessionKey) {
    if (store.remove(sessionKey) != null) {
      log.debug("Deleted session {}", SessionKeys.redact(sessionKey));
    }
  }

  @Override
  public int purgeCreatedBefore(Instant cutoff) {
    int removed = 0;
    for (SessionRecord record : store.values()) {
      if (record.createdAt().isBefore(cutoff) && store.remove(record.sessionKey(), record)) {
        removed++;
      }
    }
    log.debug("Purged {} session(s) created before {}", removed, cutoff);
    return removed;
  }

  /**
   * Number of stored sessions.
   *
   * @return the size
   */
  public int size() {
    return store.size();
  }
}
