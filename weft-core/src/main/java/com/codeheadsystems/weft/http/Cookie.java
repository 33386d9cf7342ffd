package com.codeheadsystems.weft.http;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An outgoing cookie, rendered as a {@code Set-Cookie} header value.
 *
 * @param name     cookie name
 * @param value    cookie value
 * @param path     path attribute, omitted when null
 * @param domain   domain attribute, omitted when null
 * @param maxAge   Max-Age in seconds, omitted when negative
 * @param httpOnly whether to add HttpOnly
 * @param secure   whether to add Secure
 * @param sameSite SameSite attribute, omitted when null
 */
public record Cookie(
    String name,
    String value,
    String path,
    String domain,
    long maxAge,
    boolean httpOnly,
    boolean secure,
    String sameSite) {

  /**
   * Renders the {@code Set-Cookie} header value.
   *
   * @return the header value
   */
  public String toSetCookieHeader() {
    StringBuilder sb = new StringBuilder(name).append('=').append(value == null ? "" : value);
    if (path != null) {
      sb.append("; Path=").append(path);
    }
    if (domain != null) {
      sb.append("; Domain=").append(domain);
    }
    if (maxAge >= 0) {
      sb.append("; Max-Age=").append(maxAge);
    }
    if (secure) {
      sb.append("; Secure");
    }
    if (httpOnly) {
      sb.append("; HttpOnly");
    }
    if (sameSite != null) {
      sb.append("; SameSite=").append(sameSite);
    }
    return sb.toString();
  }

  /**
   * Parses a {@code Cookie} request header into name/value pairs. The first occurrence of a
   * name wins; malformed pairs are skipped.
   *
   * @param header the header value, may be null
   * @return the cookies
   */
  public static Map<String, String> parseCookieHeader(String header) {
    Map<String, String> cookies = new LinkedHashMap<>();
    if (header == null || header.isBlank()) {
      return cookies;
    }
    for (String pair : header.split(";")) {
      int eq = pair.indexOf('=');
      if (eq <= 0) {
        continue;
      }
      String name = pair.substring(0, eq).trim();
      String value = pair.substring(eq + 1).trim();
      if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
        value = value.substring(1, value.length() - 1);
      }
      if (!name.isEmpty()) {
        cookies.putIfAbsent(name, value);
      }
    }
    return cookies;
  }
}
