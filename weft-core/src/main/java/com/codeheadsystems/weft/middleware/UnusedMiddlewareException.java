package com.codeheadsystems.weft.middleware;

/**
 * Thrown from a middleware hook to remove that middleware from the chain without it being
 * reported as a failure.
 */
public class UnusedMiddlewareException extends RuntimeException {

  /**
   * Instantiates a new Unused middleware exception.
   *
   * @param message why the middleware is leaving the chain
   */
  public UnusedMiddlewareException(final String message) {
    super(message);
  }
}
