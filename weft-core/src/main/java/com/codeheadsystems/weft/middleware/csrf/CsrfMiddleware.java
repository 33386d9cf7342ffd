package com.codeheadsystems.weft.middleware.csrf;

import com.codeheadsystems.weft.config.WeftConfig;
import com.codeheadsystems.weft.http.Request;
import com.codeheadsystems.weft.http.Response;
import com.codeheadsystems.weft.middleware.Middleware;
import com.codeheadsystems.weft.middleware.MiddlewareServices;
import com.codeheadsystems.weft.routing.Route;
import com.codeheadsystems.weft.session.Session;
import com.codeheadsystems.weft.startup.StartupCheck;
import com.fasterxml.jackson.databind.JsonNode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rejects state-changing requests that do not carry a valid CSRF token.
 * <p>
 * A request passes when its view is CSRF-exempt, when its {@code Origin} is trusted, or when
 * the same token is submitted in the {@value #FORM_FIELD} body field and the {@value #HEADER}
 * header, decrypts, names the request's session, and is younger than the expiry. Everything
 * else is answered with 403 and the view is not called.
 * <p>
 * Must come after {@code SessionMiddleware} in the chain; see {@link #checks()}. If the
 * session middleware has since been removed from the chain, state-changing requests have no
 * session to bind tokens to and are rejected.
 */
public class CsrfMiddleware implements Middleware {

  /**
   * Registry identifier.
   */
  public static final String NAME = "csrf";

  public static final String FORM_FIELD = "csrf_token";

  public static final String HEADER = "X-CSRF-Token";

  public static final String INVALID_MESSAGE = "CSRF token is invalid";

  private static final Logger log = LoggerFactory.getLogger(CsrfMiddleware.class);

  private final CsrfTokenManager tokenManager;
  private final Set<String> trustedOrigins;
  private volatile long csrfExpirySeconds;

  /**
   * Instantiates a new Csrf middleware.
   *
   * @param services the application services
   */
  public CsrfMiddleware(MiddlewareServices services) {
    this(new CsrfTokenManager(services.tokenCipher(), services.clock()), services.config());
  }

  /**
   * Instantiates a new Csrf middleware.
   *
   * @param tokenManager the token manager
   * @param config       the config
   */
  public CsrfMiddleware(CsrfTokenManager tokenManager, WeftConfig config) {
    this.tokenManager = tokenManager;
    this.trustedOrigins = config.csrfTrustedOrigins();
    this.csrfExpirySeconds = config.csrfExpirySeconds();
  }

  @Override
  public List<StartupCheck> checks() {
    return List.of(new CheckForSessionMiddleware(), new VerifyCorrectMiddlewarePlacement());
  }

  @Override
  public Optional<Response> onRequest(Request request) {
    request.session().ifPresent(session ->
        request.setCsrfTokenSupplier(() -> tokenManager.issue(session.sessionKey())));

    if (!request.isStateChanging()) {
      return Optional.empty();
    }
    if (request.route().map(Route::csrfExempt).orElse(false)) {
      log.debug("{} is CSRF exempt", request);
      return Optional.empty();
    }
    Optional<String> origin = request.header("Origin");
    if (origin.isPresent() && trustedOrigins.contains(WeftConfig.normalizeOrigin(origin.get()))) {
      log.debug("{} from trusted origin {}", request, origin.get());
      return Optional.empty();
    }

    Optional<String> failure = validate(request);
    if (failure.isPresent()) {
      log.debug("Rejecting {}: {}", request, failure.get());
      return Optional.of(forbidden());
    }
    return Optional.empty();
  }

  /**
   * Current maximum token age.
   *
   * @return the expiry in seconds
   */
  public long getCsrfExpirySeconds() {
    return csrfExpirySeconds;
  }

  /**
   * Changes the maximum token age for subsequent requests. A negative value rejects every
   * token.
   *
   * @param csrfExpirySeconds the expiry in seconds
   */
  public void setCsrfExpirySeconds(long csrfExpirySeconds) {
    this.csrfExpirySeconds = csrfExpirySeconds;
  }

  /**
   * The fixed rejection response.
   *
   * @return the response
   */
  public static Response forbidden() {
    return Response.html(403, "<h1>403 Forbidden</h1><p>" + INVALID_MESSAGE + "</p>");
  }

  private Optional<String> validate(Request request) {
    Optional<Session> session = request.session();
    if (session.isEmpty()) {
      return Optional.of("no session bound to request");
    }
    Optional<String> header = request.header(HEADER).filter(s -> !s.isBlank());
    Optional<String> field = submittedField(request);
    if (header.isEmpty() || field.isEmpty()) {
      return Optional.of("token missing from " + (header.isEmpty() ? "header" : "body"));
    }
    if (!MessageDigest.isEqual(header.get().getBytes(StandardCharsets.UTF_8),
        field.get().getBytes(StandardCharsets.UTF_8))) {
      return Optional.of("header and body tokens differ");
    }
    CsrfTokenManager.Verdict verdict =
        tokenManager.verify(header.get(), session.get().sessionKey(), csrfExpirySeconds);
    return verdict == CsrfTokenManager.Verdict.VALID ? Optional.empty() : Optional.of(verdict.name());
  }

  private Optional<String> submittedField(Request request) {
    if (request.isForm()) {
      return Optional.ofNullable(request.form().get(FORM_FIELD)).filter(s -> !s.isBlank());
    }
    if (request.contentType().filter(ct -> ct.equals("application/json") || ct.endsWith("+json")).isPresent()) {
      try {
        JsonNode node = request.json().get(FORM_FIELD);
        return node != null && node.isTextual() ? Optional.of(node.asText()) : Optional.empty();
      } catch (IllegalArgumentException e) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }
}
