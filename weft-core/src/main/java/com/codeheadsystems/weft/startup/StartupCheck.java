package com.codeheadsystems.weft.startup;

import com.codeheadsystems.weft.middleware.Middleware;
import java.util.List;
import java.util.Optional;

/**
 * A configuration check run once while the application is constructed, before any request
 * is served. Middleware declare the checks they depend on via {@link Middleware#checks()}.
 */
@FunctionalInterface
public interface StartupCheck {

  /**
   * Inspects the configured middleware chain.
   *
   * @param chain the resolved middleware, in configured order
   * @return the failure, or empty if the configuration is acceptable
   */
  Optional<StartupCheckException> check(List<Middleware> chain);
}
