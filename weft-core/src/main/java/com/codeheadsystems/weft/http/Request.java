package com.codeheadsystems.weft.http;

import com.codeheadsystems.weft.routing.Route;
import com.codeheadsystems.weft.session.Session;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * A single incoming request as delivered by the gateway, plus the request-scoped state that
 * middleware attach to it (session, resolved route, CSRF token supplier).
 * <p>
 * A request is handled on one thread; it is not safe for concurrent use.
 */
public class Request {

  private static final Set<String> SAFE_METHODS = Set.of("GET", "HEAD", "OPTIONS", "TRACE");

  private final String method;
  private final String path;
  private final String queryString;
  private final Headers headers;
  private final byte[] body;
  private final String remoteAddress;

  private Map<String, String> cookies;
  private Map<String, String> query;
  private Map<String, String> form;

  private Session session;
  private Route route;
  private Supplier<String> csrfTokenSupplier;

  private Request(Builder builder) {
    this.method = builder.method.toUpperCase(Locale.ROOT);
    this.path = builder.path;
    this.queryString = builder.queryString;
    this.headers = builder.headers;
    this.body = builder.body;
    this.remoteAddress = builder.remoteAddress;
  }

  /**
   * Builder.
   *
   * @return the builder
   */
  public static Builder builder() {
    return new Builder();
  }

  public String method() {
    return method;
  }

  public String path() {
    return path;
  }

  public String queryString() {
    return queryString;
  }

  public Headers headers() {
    return headers;
  }

  /**
   * First value of a header.
   *
   * @param name the header name (case-insensitive)
   * @return the value, or empty
   */
  public Optional<String> header(String name) {
    return headers.first(name);
  }

  public byte[] body() {
    return body.clone();
  }

  public int bodyLength() {
    return body.length;
  }

  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  public String remoteAddress() {
    return remoteAddress;
  }

  /**
   * Whether the method can change server state (anything but GET, HEAD, OPTIONS, TRACE).
   *
   * @return true for POST, PUT, PATCH, DELETE and unknown methods
   */
  public boolean isStateChanging() {
    return !SAFE_METHODS.contains(method);
  }

  /**
   * The media type of the body without parameters, lower-cased.
   *
   * @return the content type, or empty
   */
  public Optional<String> contentType() {
    return headers.first("Content-Type")
        .map(ct -> {
          int semi = ct.indexOf(';');
          return (semi < 0 ? ct : ct.substring(0, semi)).trim().toLowerCase(Locale.ROOT);
        });
  }

  /**
   * Cookies sent with the request, across every {@code Cookie} header. The first occurrence of a
   * name wins.
   *
   * @return name to value
   */
  public Map<String, String> cookies() {
    if (cookies == null) {
      cookies = Cookie.parseCookieHeader(String.join("; ", headers.all("Cookie")));
    }
    return cookies;
  }

  /**
   * Query string parameters.
   *
   * @return name to first value
   */
  public Map<String, String> query() {
    if (query == null) {
      query = FormParser.parse(queryString);
    }
    return query;
  }

  /**
   * Fields of a url-encoded form body. Empty for any other content type.
   *
   * @return name to first value
   */
  public Map<String, String> form() {
    if (form == null) {
      form = isForm() ? FormParser.parse(bodyAsString()) : Map.of();
    }
    return form;
  }

  public boolean isForm() {
    return contentType().filter(FormParser.FORM_URLENCODED::equals).isPresent();
  }

  /**
   * Parses the body as JSON.
   *
   * @return the JSON tree
   * @throws IllegalArgumentException if the body is not valid JSON
   */
  public JsonNode json() {
    try {
      return Json.mapper().readTree(body);
    } catch (IOException e) {
      throw new IllegalArgumentException("Request body is not valid JSON", e);
    }
  }

  /**
   * The session bound by the session middleware, if any.
   *
   * @return the session
   */
  public Optional<Session> session() {
    return Optional.ofNullable(session);
  }

  /**
   * The session, failing when no session middleware has run.
   *
   * @return the session
   * @throws IllegalStateException if no session is bound
   */
  public Session requireSession() {
    if (session == null) {
      throw new IllegalStateException("No session bound to request; is the session middleware configured?");
    }
    return session;
  }

  public void setSession(Session session) {
    this.session = session;
  }

  /**
   * The route the request resolved to, if any.
   *
   * @return the route
   */
  public Optional<Route> route() {
    return Optional.ofNullable(route);
  }

  public void setRoute(Route route) {
    this.route = route;
  }

  /**
   * Mints a CSRF token bound to this request's session.
   *
   * @return the token
   * @throws IllegalStateException if CSRF protection is not active for this request
   */
  public String csrfToken() {
    if (csrfTokenSupplier == null) {
      throw new IllegalStateException("CSRF middleware is not active for this request");
    }
    return csrfTokenSupplier.get();
  }

  public void setCsrfTokenSupplier(Supplier<String> csrfTokenSupplier) {
    this.csrfTokenSupplier = csrfTokenSupplier;
  }

  @Override
  public String toString() {
    return method + " " + path;
  }

  /**
   * Builder for requests arriving through a gateway.
   */
  public static class Builder {

    private String method = "GET";
    private String path = "/";
    private String queryString = "";
    private final Headers headers = new Headers();
    private byte[] body = new byte[0];
    private String remoteAddress = "";

    private Builder() {
    }

    public Builder method(String method) {
      this.method = method;
      return this;
    }

    public Builder path(String path) {
      this.path = (path == null || path.isEmpty()) ? "/" : path;
      return this;
    }

    public Builder queryString(String queryString) {
      this.queryString = queryString == null ? "" : queryString;
      return this;
    }

    public Builder header(String name, String value) {
      headers.add(name, value);
      return this;
    }

    public Builder body(byte[] body) {
      this.body = body == null ? new byte[0] : body.clone();
      return this;
    }

    public Builder body(String body) {
      return body(body.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Url-encoded form body; also sets the content type.
     *
     * @param encodedForm e.g. {@code name=bob&csrf_token=...}
     * @return this
     */
    public Builder form(String encodedForm) {
      headers.set("Content-Type", FormParser.FORM_URLENCODED);
      return body(encodedForm);
    }

    public Builder remoteAddress(String remoteAddress) {
      this.remoteAddress = remoteAddress == null ? "" : remoteAddress;
      return this;
    }

    public Request build() {
      return new Request(this);
    }
  }
}
