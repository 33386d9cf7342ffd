package com.codeheadsystems.weft.config;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Application configuration, fixed at construction.
 *
 * @param middleware            middleware identifiers, in chain order
 * @param sessionMaxAgeSeconds  sessions at least this old are replaced by new ones
 * @param csrfExpirySeconds     CSRF tokens at least this old are rejected; negative rejects all
 * @param csrfTrustedOrigins    origins whose state-changing requests skip CSRF validation, normalized
 * @param sessionCookieName     name of the session cookie
 * @param sessionCookiePath     Path attribute of the session cookie
 * @param sessionCookieDomain   Domain attribute of the session cookie, null to omit
 * @param sessionCookieSecure   whether the session cookie is Secure
 * @param sessionCookieHttpOnly whether the session cookie is HttpOnly
 * @param sessionCookieSameSite SameSite attribute of the session cookie, null to omit
 * @param secretKey             hex-encoded 32-byte key, or a passphrase; empty for a random key
 * @param maxRequestBodyBytes   larger request bodies are answered with 413
 */
public record WeftConfig(
    List<String> middleware,
    long sessionMaxAgeSeconds,
    long csrfExpirySeconds,
    Set<String> csrfTrustedOrigins,
    String sessionCookieName,
    String sessionCookiePath,
    String sessionCookieDomain,
    boolean sessionCookieSecure,
    boolean sessionCookieHttpOnly,
    String sessionCookieSameSite,
    String secretKey,
    long maxRequestBodyBytes) {

  /**
   * Two weeks.
   */
  public static final long DEFAULT_SESSION_MAX_AGE_SECONDS = 60L * 60 * 24 * 14;

  /**
   * One hour.
   */
  public static final long DEFAULT_CSRF_EXPIRY_SECONDS = 60L * 60;

  public static final String DEFAULT_SESSION_COOKIE_NAME = "swsession";

  public static final long DEFAULT_MAX_REQUEST_BODY_BYTES = 1024L * 1024;

  /**
   * Instantiates a new Weft config.
   */
  public WeftConfig {
    middleware = List.copyOf(middleware);
    csrfTrustedOrigins = csrfTrustedOrigins.stream()
        .map(WeftConfig::normalizeOrigin)
        .collect(Collectors.toUnmodifiableSet());
    if (sessionCookieName == null || sessionCookieName.isBlank()) {
      throw new IllegalArgumentException("sessionCookieName must not be blank");
    }
    if (sessionMaxAgeSeconds <= 0) {
      throw new IllegalArgumentException("sessionMaxAgeSeconds must be positive");
    }
    if (maxRequestBodyBytes <= 0) {
      throw new IllegalArgumentException("maxRequestBodyBytes must be positive");
    }
    secretKey = secretKey == null ? "" : secretKey;
  }

  /**
   * Builder.
   *
   * @return the builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Normalizes an origin for comparison: lower case, no trailing slash.
   *
   * @param origin the origin
   * @return the normalized origin
   */
  public static String normalizeOrigin(String origin) {
    String o = origin.trim().toLowerCase(Locale.ROOT);
    while (o.endsWith("/")) {
      o = o.substring(0, o.length() - 1);
    }
    return o;
  }

  /**
   * Builder for {@link WeftConfig}.
   */
  public static class Builder {

    private final List<String> middleware = new ArrayList<>();
    private long sessionMaxAgeSeconds = DEFAULT_SESSION_MAX_AGE_SECONDS;
    private long csrfExpirySeconds = DEFAULT_CSRF_EXPIRY_SECONDS;
    private final Set<String> csrfTrustedOrigins = new LinkedHashSet<>();
    private String sessionCookieName = DEFAULT_SESSION_COOKIE_NAME;
    private String sessionCookiePath = "/";
    private String sessionCookieDomain;
    private boolean sessionCookieSecure;
    private boolean sessionCookieHttpOnly = true;
    private String sessionCookieSameSite = "Lax";
    private String secretKey = "";
    private long maxRequestBodyBytes = DEFAULT_MAX_REQUEST_BODY_BYTES;

    private Builder() {
    }

    public Builder middleware(String... identifiers) {
      return middleware(List.of(identifiers));
    }

    /**
     * Appends middleware identifiers.
     *
     * @param identifiers the identifiers
     * @return this
     */
    public Builder middleware(List<String> identifiers) {
      middleware.addAll(identifiers);
      return this;
    }

    public Builder sessionMaxAgeSeconds(long sessionMaxAgeSeconds) {
      this.sessionMaxAgeSeconds = sessionMaxAgeSeconds;
      return this;
    }

    public Builder csrfExpirySeconds(long csrfExpirySeconds) {
      this.csrfExpirySeconds = csrfExpirySeconds;
      return this;
    }

    /**
     * Adds trusted origins, e.g. {@code https://example.com}.
     *
     * @param origins the origins
     * @return this
     */
    public Builder csrfTrustedOrigins(List<String> origins) {
      csrfTrustedOrigins.addAll(origins);
      return this;
    }

    public Builder csrfTrustedOrigins(String... origins) {
      return csrfTrustedOrigins(List.of(origins));
    }

    public Builder sessionCookieName(String sessionCookieName) {
      this.sessionCookieName = sessionCookieName;
      return this;
    }

    public Builder sessionCookiePath(String sessionCookiePath) {
      this.sessionCookiePath = sessionCookiePath;
      return this;
    }

    public Builder sessionCookieDomain(String sessionCookieDomain) {
      this.sessionCookieDomain = sessionCookieDomain;
      return this;
    }

    public Builder sessionCookieSecure(boolean sessionCookieSecure) {
      this.sessionCookieSecure = sessionCookieSecure;
      return this;
    }

    public Builder sessionCookieHttpOnly(boolean sessionCookieHttpOnly) {
      this.sessionCookieHttpOnly = sessionCookieHttpOnly;
      return this;
    }

    public Builder sessionCookieSameSite(String sessionCookieSameSite) {
      this.sessionCookieSameSite = sessionCookieSameSite;
      return this;
    }

    public Builder secretKey(String secretKey) {
      this.secretKey = secretKey;
      return this;
    }

    public Builder maxRequestBodyBytes(long maxRequestBodyBytes) {
      this.maxRequestBodyBytes = maxRequestBodyBytes;
      return this;
    }

    /**
     * Build weft config.
     *
     * @return the weft config
     */
    public WeftConfig build() {
      return new WeftConfig(middleware, sessionMaxAgeSeconds, csrfExpirySeconds, csrfTrustedOrigins,
          sessionCookieName, sessionCookiePath, sessionCookieDomain, sessionCookieSecure,
          sessionCookieHttpOnly, sessionCookieSameSite, secretKey, maxRequestBodyBytes);
    }
  }
}
