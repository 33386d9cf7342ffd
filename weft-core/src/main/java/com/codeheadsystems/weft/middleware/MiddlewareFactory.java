package com.codeheadsystems.weft.middleware;

/**
 * Creates a middleware instance for a configured identifier.
 */
@FunctionalInterface
public interface MiddlewareFactory {

  /**
   * Create middleware.
   *
   * @param services the application services
   * @return the middleware
   */
  Middleware create(MiddlewareServices services);
}
