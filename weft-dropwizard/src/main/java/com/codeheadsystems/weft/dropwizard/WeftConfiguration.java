package com.codeheadsystems.weft.dropwizard;

import com.codeheadsystems.weft.config.WeftConfig;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;

/**
 * Dropwizard configuration for a weft application.
 * <p>
 * For production, set {@code secretKey} to a hex-encoded 32-byte value so that CSRF tokens
 * survive restarts and are accepted by every instance behind a load balancer. Leaving it
 * empty generates a random key on each startup (dev/test only).
 * <p>
 * Generate a key with: {@code openssl rand -hex 32}
 */
public class WeftConfiguration extends Configuration {

  /**
   * Servlet mapping the weft application is mounted at.
   */
  @NotEmpty
  private String mountPath = "/web/*";

  /**
   * Middleware identifiers in chain order. Built-ins are {@code session} and {@code csrf};
   * anything else is loaded as a fully-qualified class name.
   */
  @NotNull
  private List<String> middleware = new ArrayList<>(List.of("session", "csrf"));

  /**
   * Sessions created at least this many seconds ago are replaced.
   */
  @Min(1)
  private long sessionMaxAgeSeconds = WeftConfig.DEFAULT_SESSION_MAX_AGE_SECONDS;

  /**
   * CSRF tokens issued at least this many seconds ago are rejected. -1 rejects every token.
   */
  @Min(-1)
  private long csrfExpirySeconds = WeftConfig.DEFAULT_CSRF_EXPIRY_SECONDS;

  /**
   * Origins ({@code scheme://host[:port]}) whose state-changing requests skip CSRF validation.
   */
  @NotNull
  private List<String> csrfTrustedOrigins = new ArrayList<>();

  @NotEmpty
  private String sessionCookieName = WeftConfig.DEFAULT_SESSION_COOKIE_NAME;

  @NotEmpty
  private String sessionCookiePath = "/";

  private String sessionCookieDomain;

  private boolean sessionCookieSecure;

  private boolean sessionCookieHttpOnly = true;

  private String sessionCookieSameSite = "Lax";

  /**
   * Hex-encoded 32-byte key, or a passphrase the key is derived from.
   * Leave empty for random generation (dev only).
   */
  private String secretKey = "";

  /**
   * Requests with larger bodies are answered with HTTP 413.
   */
  @Min(1)
  private long maxRequestBodyBytes = WeftConfig.DEFAULT_MAX_REQUEST_BODY_BYTES;

  /**
   * The core configuration these settings describe.
   *
   * @return the weft config
   */
  public WeftConfig toWeftConfig() {
    return WeftConfig.builder()
        .middleware(middleware)
        .sessionMaxAgeSeconds(sessionMaxAgeSeconds)
        .csrfExpirySeconds(csrfExpirySeconds)
        .csrfTrustedOrigins(csrfTrustedOrigins)
        .sessionCookieName(sessionCookieName)
        .sessionCookiePath(sessionCookiePath)
        .sessionCookieDomain(sessionCookieDomain)
        .sessionCookieSecure(sessionCookieSecure)
        .sessionCookieHttpOnly(sessionCookieHttpOnly)
        .sessionCookieSameSite(sessionCookieSameSite)
        .secretKey(secretKey)
        .maxRequestBodyBytes(maxRequestBodyBytes)
        .build();
  }

  /**
   * Gets mount path.
   *
   * @return the mount path
   */
  @JsonProperty
  public String getMountPath() {
    return mountPath;
  }

  /**
   * Sets mount path.
   *
   * @param mountPath the mount path
   */
  @JsonProperty
  public void setMountPath(String mountPath) {
    this.mountPath = mountPath;
  }

  /**
   * Gets middleware.
   *
   * @return the middleware
   */
  @JsonProperty
  public List<String> getMiddleware() {
    return middleware;
  }

  /**
   * Sets middleware.
   *
   * @param middleware the middleware
   */
  @JsonProperty
  public void setMiddleware(List<String> middleware) {
    this.middleware = middleware;
  }

  /**
   * Gets session max age seconds.
   *
   * @return the session max age seconds
   */
  @JsonProperty
  public long getSessionMaxAgeSeconds() {
    return sessionMaxAgeSeconds;
  }

  /**
   * Sets session max age seconds.
   *
   * @param sessionMaxAgeSeconds the session max age seconds
   */
  @JsonProperty
  public void setSessionMaxAgeSeconds(long sessionMaxAgeSeconds) {
    this.sessionMaxAgeSeconds = sessionMaxAgeSeconds;
  }

  /**
   * Gets csrf expiry seconds.
   *
   * @return the csrf expiry seconds
   */
  @JsonProperty
  public long getCsrfExpirySeconds() {
    return csrfExpirySeconds;
  }

  /**
   * Sets csrf expiry seconds.
   *
   * @param csrfExpirySeconds the csrf expiry seconds
   */
  @JsonProperty
  public void setCsrfExpirySeconds(long csrfExpirySeconds) {
    this.csrfExpirySeconds = csrfExpirySeconds;
  }

  /**
   * Gets csrf trusted origins.
   *
   * @return the csrf trusted origins
   */
  @JsonProperty
  public List<String> getCsrfTrustedOrigins() {
    return csrfTrustedOrigins;
  }

  /**
   * Sets csrf trusted origins.
   *
   * @param csrfTrustedOrigins the csrf trusted origins
   */
  @JsonProperty
  public void setCsrfTrustedOrigins(List<String> csrfTrustedOrigins) {
    this.csrfTrustedOrigins = csrfTrustedOrigins;
  }

  @JsonProperty
  public String getSessionCookieName() {
    return sessionCookieName;
  }

  @JsonProperty
  public void setSessionCookieName(String sessionCookieName) {
    this.sessionCookieName = sessionCookieName;
  }

  @JsonProperty
  public String getSessionCookiePath() {
    return sessionCookiePath;
  }

  @JsonProperty
  public void setSessionCookiePath(String sessionCookiePath) {
    this.sessionCookiePath = sessionCookiePath;
  }

  @JsonProperty
  public String getSessionCookieDomain() {
    return sessionCookieDomain;
  }

  @JsonProperty
  public void setSessionCookieDomain(String sessionCookieDomain) {
    this.sessionCookieDomain = sessionCookieDomain;
  }

  @JsonProperty
  public boolean isSessionCookieSecure() {
    return sessionCookieSecure;
  }

  @JsonProperty
  public void setSessionCookieSecure(boolean sessionCookieSecure) {
    this.sessionCookieSecure = sessionCookieSecure;
  }

  @JsonProperty
  public boolean isSessionCookieHttpOnly() {
    return sessionCookieHttpOnly;
  }

  @JsonProperty
  public void setSessionCookieHttpOnly(boolean sessionCookieHttpOnly) {
    this.sessionCookieHttpOnly = sessionCookieHttpOnly;
  }

  @JsonProperty
  public String getSessionCookieSameSite() {
    return sessionCookieSameSite;
  }

  @JsonProperty
  public void setSessionCookieSameSite(String sessionCookieSameSite) {
    this.sessionCookieSameSite = sessionCookieSameSite;
  }

  /**
   * Gets secret key.
   *
   * @return the secret key
   */
  @JsonProperty
  public String getSecretKey() {
    return secretKey;
  }

  /**
   * Sets secret key.
   *
   * @param secretKey the secret key
   */
  @JsonProperty
  public void setSecretKey(String secretKey) {
    this.secretKey = secretKey;
  }

  /**
   * Gets max request body bytes.
   *
   * @return the max request body bytes
   */
  @JsonProperty
  public long getMaxRequestBodyBytes() {
    return maxRequestBodyBytes;
  }

  /**
   * Sets max request body bytes.
   *
   * @param maxRequestBodyBytes the max request body bytes
   */
  @JsonProperty
  public void setMaxRequestBodyBytes(long maxRequestBodyBytes) {
    this.maxRequestBodyBytes = maxRequestBodyBytes;
  }
}
