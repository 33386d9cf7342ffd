package com.codeheadsystems.weft.routing;

import java.util.Set;

/**
 * A path bound to a view.
 *
 * @param path    exact request path
 * @param view    the view
 * @param methods allowed methods, upper case
 */
public record Route(String path, View view, Set<String> methods) {

  /**
   * Instantiates a new Route.
   */
  public Route {
    methods = Set.copyOf(methods);
  }

  public boolean allows(String method) {
    return methods.contains(method);
  }

  public boolean csrfExempt() {
    return view.isCsrfExempt();
  }
}
