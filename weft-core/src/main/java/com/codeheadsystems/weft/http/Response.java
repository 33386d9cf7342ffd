package com.codeheadsystems.weft.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.nio.charset.StandardCharsets;

/**
 * An outgoing response. Headers stay mutable so that response-phase middleware can add cookies.
 */
public class Response {

  private final int status;
  private final Headers headers = new Headers();
  private final byte[] body;

  /**
   * Instantiates a new Response.
   *
   * @param status      the status
   * @param contentType the content type, omitted when null
   * @param body        the body
   */
  public Response(int status, String contentType, byte[] body) {
    this.status = status;
    this.body = body == null ? new byte[0] : body;
    if (contentType != null) {
      headers.set("Content-Type", contentType);
    }
  }

  /**
   * HTML response.
   *
   * @param status the status
   * @param html   the html
   * @return the response
   */
  public static Response html(int status, String html) {
    return new Response(status, "text/html; charset=utf-8", html.getBytes(StandardCharsets.UTF_8));
  }

  public static Response html(String html) {
    return html(200, html);
  }

  /**
   * Plain text response.
   *
   * @param status the status
   * @param text   the text
   * @return the response
   */
  public static Response text(int status, String text) {
    return new Response(status, "text/plain; charset=utf-8", text.getBytes(StandardCharsets.UTF_8));
  }

  public static Response text(String text) {
    return text(200, text);
  }

  /**
   * JSON response serialized with Jackson.
   *
   * @param status the status
   * @param value  the value to serialize
   * @return the response
   */
  public static Response json(int status, Object value) {
    try {
      return new Response(status, "application/json", Json.mapper().writeValueAsBytes(value));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Value cannot be serialized to JSON", e);
    }
  }

  public static Response json(Object value) {
    return json(200, value);
  }

  public int status() {
    return status;
  }

  public Headers headers() {
    return headers;
  }

  public byte[] body() {
    return body;
  }

  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  /**
   * Adds a {@code Set-Cookie} header.
   *
   * @param cookie the cookie
   * @return this
   */
  public Response addCookie(Cookie cookie) {
    headers.add("Set-Cookie", cookie.toSetCookieHeader());
    return this;
  }
}
