package com.codeheadsystems.weft.middleware;

import com.codeheadsystems.weft.http.Request;
import com.codeheadsystems.weft.http.Response;
import com.codeheadsystems.weft.startup.StartupCheck;
import java.util.List;
import java.util.Optional;

/**
 * A request/response interceptor in the application's middleware chain.
 * <p>
 * Instances are shared by every in-flight request and must be thread-safe. A hook that throws
 * is removed from the chain for the lifetime of the application; the request carries on
 * without it. Throw {@link UnusedMiddlewareException} to leave the chain deliberately.
 */
public interface Middleware {

  /**
   * Called before dispatch, in configured order.
   *
   * @param request the request
   * @return a response to send instead of dispatching to the view, or empty to continue
   */
  default Optional<Response> onRequest(Request request) {
    return Optional.empty();
  }

  /**
   * Called after dispatch, in reverse configured order. May add headers to the response.
   *
   * @param request  the request
   * @param response the response
   */
  default void onResponse(Request request, Response response) {
  }

  /**
   * Checks to run against the whole chain at startup.
   *
   * @return the checks
   */
  default List<StartupCheck> checks() {
    return List.of();
  }

  /**
   * Name used in logs.
   *
   * @return the name
   */
  default String name() {
    String simple = getClass().getSimpleName();
    return simple.isEmpty() ? getClass().getName() : simple;
  }
}
