package com.codeheadsystems.weft.middleware.session;

import com.codeheadsystems.weft.config.WeftConfig;
import com.codeheadsystems.weft.http.Cookie;
import com.codeheadsystems.weft.http.Request;
import com.codeheadsystems.weft.http.Response;
import com.codeheadsystems.weft.middleware.Middleware;
import com.codeheadsystems.weft.middleware.MiddlewareServices;
import com.codeheadsystems.weft.session.Session;
import com.codeheadsystems.weft.session.SessionCodec;
import com.codeheadsystems.weft.session.SessionKeys;
import com.codeheadsystems.weft.session.SessionRecord;
import com.codeheadsystems.weft.session.SessionStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds a {@link Session} to every request and persists it after the response.
 * <p>
 * The session key travels in a cookie. A missing, unknown, or expired key silently gets a new
 * session: expired sessions are never reused, they are replaced by one with a new key and a
 * new creation time.
 */
public class SessionMiddleware implements Middleware {

  /**
   * Registry identifier.
   */
  public static final String NAME = "session";

  private static final Logger log = LoggerFactory.getLogger(SessionMiddleware.class);

  private final SessionStore sessionStore;
  private final Clock clock;
  private final WeftConfig config;

  /**
   * Instantiates a new Session middleware.
   *
   * @param services the application services
   */
  public SessionMiddleware(MiddlewareServices services) {
    this(services.sessionStore(), services.clock(), services.config());
  }

  /**
   * Instantiates a new Session middleware.
   *
   * @param sessionStore the session store
   * @param clock        the clock
   * @param config       the config
   */
  public SessionMiddleware(SessionStore sessionStore, Clock clock, WeftConfig config) {
    this.sessionStore = sessionStore;
    this.clock = clock;
    this.config = config;
  }

  @Override
  public Optional<Response> onRequest(Request request) {
    String cookieKey = request.cookies().get(config.sessionCookieName());
    Instant now = clock.instant();

    SessionRecord record = null;
    if (cookieKey != null && !cookieKey.isEmpty()) {
      record = sessionStore.load(cookieKey)
          .filter(r -> {
            if (r.isExpired(now, config.sessionMaxAgeSeconds())) {
              log.debug("Session {} expired (created {})", SessionKeys.redact(r.sessionKey()), r.createdAt());
              return false;
            }
            return true;
          })
          .orElse(null);
    }
    if (record == null) {
      record = sessionStore.create(request.remoteAddress(), request.header("User-Agent").orElse(""));
      log.debug("Issued new session {} for {}", SessionKeys.redact(record.sessionKey()), request);
    }
    request.setSession(SessionCodec.toSession(record));
    return Optional.empty();
  }

  @Override
  public void onResponse(Request request, Response response) {
    Optional<Session> bound = request.session();
    if (bound.isEmpty()) {
      return;
    }
    Session session = bound.get();
    if (session.isInvalidated()) {
      sessionStore.delete(session.sessionKey());
      response.addCookie(cookie("", 0));
      return;
    }

    Instant now = clock.instant();
    SessionRecord record = sessionStore.load(session.sessionKey())
        .orElseGet(() -> new SessionRecord(session.sessionKey(), SessionCodec.EMPTY, session.createdAt(),
            now, request.remoteAddress(), request.header("User-Agent").orElse("")));
    sessionStore.save(record.withData(SessionCodec.encode(session), now));
    response.addCookie(cookie(session.sessionKey(), config.sessionMaxAgeSeconds()));
  }

  private Cookie cookie(String value, long maxAge) {
    return new Cookie(config.sessionCookieName(), value, config.sessionCookiePath(),
        config.sessionCookieDomain(), maxAge, config.sessionCookieHttpOnly(),
        config.sessionCookieSecure(), config.sessionCookieSameSite());
  }
}
