package com.codeheadsystems.weft.routing;

import com.codeheadsystems.weft.http.Request;
import com.codeheadsystems.weft.http.Response;

/**
 * Application code that turns a request into a response.
 */
@FunctionalInterface
public interface View {

  /**
   * Handle.
   *
   * @param request the request
   * @return the response
   * @throws Exception any failure; the application answers it with 500
   */
  Response handle(Request request) throws Exception;

  /**
   * Whether CSRF validation is skipped for requests to this view.
   *
   * @return false unless wrapped by {@link #csrfExempt(View)}
   */
  default boolean isCsrfExempt() {
    return false;
  }

  /**
   * Marks a view as exempt from CSRF validation, whatever the request method.
   *
   * @param view the view
   * @return the exempt view
   */
  static View csrfExempt(View view) {
    return new View() {
      @Override
      public Response handle(Request request) throws Exception {
        return view.handle(request);
      }

      @Override
      public boolean isCsrfExempt() {
        return true;
      }
    };
  }
}
