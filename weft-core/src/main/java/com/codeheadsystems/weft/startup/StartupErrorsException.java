package com.codeheadsystems.weft.startup;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised by application construction when one or more startup checks fail. The application
 * must not start.
 */
public class StartupErrorsException extends RuntimeException {

  private final List<StartupCheckException> errors;

  /**
   * Instantiates a new Startup errors exception.
   *
   * @param errors every failed check, in the order they were found
   */
  public StartupErrorsException(final List<StartupCheckException> errors) {
    super("Problems were identified during startup: " + errors.stream()
        .map(Throwable::getMessage)
        .collect(Collectors.joining("; ")));
    this.errors = List.copyOf(errors);
    this.errors.forEach(this::addSuppressed);
  }

  /**
   * The individual failures.
   *
   * @return the errors
   */
  public List<StartupCheckException> errors() {
    return errors;
  }
}
