package com.codeheadsystems.weft.session;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Generates session keys: 256 random bits, base64url without padding.
 */
public final class SessionKeys {

  private static final SecureRandom RANDOM = new SecureRandom();
  private static final Base64.Encoder B64 = Base64.getUrlEncoder().withoutPadding();

  private SessionKeys() {
  }

  public static String generate() {
    byte[] bytes = new byte[32];
    RANDOM.nextBytes(bytes);
    return B64.encodeToString(bytes);
  }

  /**
   * Shortened key for log lines.
   *
   * @param sessionKey the session key
   * @return the first characters followed by an ellipsis
   */
  public static String redact(String sessionKey) {
    if (sessionKey == null) {
      return "null";
    }
    return sessionKey.length() <= 6 ? "***" : sessionKey.substring(0, 6) + "...";
  }
}
