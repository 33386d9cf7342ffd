package com.codeheadsystems.weft.http;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses {@code application/x-www-form-urlencoded} bodies and query strings.
 */
public final class FormParser {

  /**
   * Content type of HTML form posts.
   */
  public static final String FORM_URLENCODED = "application/x-www-form-urlencoded";

  private FormParser() {
  }

  /**
   * Decodes {@code a=1&b=2}. Repeated names keep their first value; names without {@code =}
   * map to the empty string.
   *
   * @param encoded the encoded string, may be null
   * @return the fields in order of appearance
   */
  public static Map<String, String> parse(String encoded) {
    Map<String, String> fields = new LinkedHashMap<>();
    if (encoded == null || encoded.isEmpty()) {
      return fields;
    }
    for (String pair : encoded.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int eq = pair.indexOf('=');
      String name = eq < 0 ? pair : pair.substring(0, eq);
      String value = eq < 0 ? "" : pair.substring(eq + 1);
      fields.putIfAbsent(decode(name), decode(value));
    }
    return fields;
  }

  private static String decode(String s) {
    try {
      return URLDecoder.decode(s, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      // Malformed percent escape; keep the raw text.
      return s;
    }
  }
}
