package com.codeheadsystems.weft.startup;

/**
 * One failed startup check. The message is a fixed constant owned by the check so callers can
 * match on it.
 */
public class StartupCheckException extends RuntimeException {

  /**
   * Instantiates a new Startup check exception.
   *
   * @param message the message
   */
  public StartupCheckException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Startup check exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public StartupCheckException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
