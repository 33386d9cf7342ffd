package com.codeheadsystems.weft.middleware.csrf;

import com.codeheadsystems.weft.http.Request;

/**
 * View helpers for embedding CSRF tokens in rendered HTML.
 */
public final class CsrfTokens {

  private CsrfTokens() {
  }

  /**
   * A hidden form input carrying a fresh token for the request's session.
   *
   * @param request the request
   * @return the input element
   * @throws IllegalStateException if CSRF protection is not active for the request
   */
  public static String hiddenInput(Request request) {
    // Tokens are base64url, so they need no HTML escaping.
    return "<input type=\"hidden\" name=\"" + CsrfMiddleware.FORM_FIELD
        + "\" value=\"" + request.csrfToken() + "\">";
  }
}
