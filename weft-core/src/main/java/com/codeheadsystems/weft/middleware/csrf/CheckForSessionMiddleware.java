package com.codeheadsystems.weft.middleware.csrf;

import com.codeheadsystems.weft.middleware.Middleware;
import com.codeheadsystems.weft.middleware.session.SessionMiddleware;
import com.codeheadsystems.weft.startup.StartupCheck;
import com.codeheadsystems.weft.startup.StartupCheckException;
import java.util.List;
import java.util.Optional;

/**
 * Fails startup when CSRF protection is configured without session middleware.
 */
public class CheckForSessionMiddleware implements StartupCheck {

  public static final String SESSION_MIDDLEWARE_NOT_FOUND =
      "Session middleware is not enabled. It must be listed above"
          + " CSRFMiddleware in the middleware list.";

  @Override
  public Optional<StartupCheckException> check(List<Middleware> chain) {
    boolean present = chain.stream().anyMatch(SessionMiddleware.class::isInstance);
    return present ? Optional.empty() : Optional.of(new StartupCheckException(SESSION_MIDDLEWARE_NOT_FOUND));
  }
}
