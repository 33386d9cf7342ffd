package com.codeheadsystems.weft.routing;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Exact-path route table. A trailing slash is ignored, except for the root path.
 */
public class Router {

  private final Map<String, Route> routes = new ConcurrentHashMap<>();

  /**
   * Binds a path to a view.
   *
   * @param path    the path
   * @param view    the view
   * @param methods allowed methods; GET when none are given
   * @return the route
   * @throws IllegalArgumentException if the path is already bound
   */
  public Route add(String path, View view, String... methods) {
    Set<String> allowed = methods.length == 0
        ? Set.of("GET")
        : Arrays.stream(methods).map(m -> m.toUpperCase(Locale.ROOT)).collect(Collectors.toSet());
    Route route = new Route(normalize(path), view, allowed);
    if (routes.putIfAbsent(route.path(), route) != null) {
      throw new IllegalArgumentException("Path already routed: " + route.path());
    }
    return route;
  }

  /**
   * Finds the route for a request path.
   *
   * @param path the path
   * @return the route, or empty
   */
  public Optional<Route> resolve(String path) {
    return Optional.ofNullable(routes.get(normalize(path)));
  }

  private static String normalize(String path) {
    if (path == null || path.isEmpty()) {
      return "/";
    }
    String p = path.startsWith("/") ? path : "/" + path;
    while (p.length() > 1 && p.endsWith("/")) {
      p = p.substring(0, p.length() - 1);
    }
    return p;
  }
}
