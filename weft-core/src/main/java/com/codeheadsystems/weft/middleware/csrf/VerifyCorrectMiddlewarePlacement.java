package com.codeheadsystems.weft.middleware.csrf;

import com.codeheadsystems.weft.middleware.Middleware;
import com.codeheadsystems.weft.middleware.session.SessionMiddleware;
import com.codeheadsystems.weft.startup.StartupCheck;
import com.codeheadsystems.weft.startup.StartupCheckException;
import java.util.List;
import java.util.Optional;

/**
 * Fails startup when session middleware comes after CSRF middleware in the chain.
 * A missing session middleware is reported by {@link CheckForSessionMiddleware} instead.
 */
public class VerifyCorrectMiddlewarePlacement implements StartupCheck {

  public static final String SESSION_MIDDLEWARE_BELOW_CSRF =
      "SessionMiddleware is enabled, but it must be listed above"
          + " CSRFMiddleware in the middleware list.";

  @Override
  public Optional<StartupCheckException> check(List<Middleware> chain) {
    int session = indexOf(chain, SessionMiddleware.class);
    int csrf = indexOf(chain, CsrfMiddleware.class);
    if (session < 0 || csrf < 0 || session < csrf) {
      return Optional.empty();
    }
    return Optional.of(new StartupCheckException(SESSION_MIDDLEWARE_BELOW_CSRF));
  }

  private static int indexOf(List<Middleware> chain, Class<? extends Middleware> type) {
    for (int i = 0; i < chain.size(); i++) {
      if (type.isInstance(chain.get(i))) {
        return i;
      }
    }
    return -1;
  }
}
