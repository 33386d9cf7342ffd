package com.codeheadsystems.weft.middleware.csrf;

import com.codeheadsystems.weft.crypto.DecryptionException;
import com.codeheadsystems.weft.crypto.TokenCipher;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;

/**
 * Issues and verifies stateless CSRF tokens.
 * <p>
 * A token is {@code nonce::sessionKey::issuedAtMillis}, encrypted with the application's
 * {@link TokenCipher}. Nothing is stored server-side: validity is recomputed from the
 * decrypted payload on every request, and a token stays usable until it expires.
 */
public class CsrfTokenManager {

  static final String SEPARATOR = "::";

  private static final Base64.Encoder B64 = Base64.getUrlEncoder().withoutPadding();

  private final TokenCipher cipher;
  private final Clock clock;
  private final SecureRandom random = new SecureRandom();

  /**
   * Instantiates a new Csrf token manager.
   *
   * @param cipher the cipher
   * @param clock  the clock
   */
  public CsrfTokenManager(TokenCipher cipher, Clock clock) {
    this.cipher = cipher;
    this.clock = clock;
  }

  /**
   * Outcome of verifying a token.
   */
  public enum Verdict {
    VALID,
    UNDECRYPTABLE,
    MALFORMED,
    SESSION_MISMATCH,
    EXPIRED
  }

  /**
   * Mints a token bound to the session.
   *
   * @param sessionKey the session key
   * @return the token
   */
  public String issue(String sessionKey) {
    byte[] nonce = new byte[16];
    random.nextBytes(nonce);
    return cipher.encrypt(B64.encodeToString(nonce) + SEPARATOR + sessionKey + SEPARATOR + clock.millis());
  }

  /**
   * Verifies a token against the current session.
   *
   * @param token         the submitted token
   * @param sessionKey    the key of the session bound to the request
   * @param expirySeconds maximum token age; negative rejects every token
   * @return the verdict
   */
  public Verdict verify(String token, String sessionKey, long expirySeconds) {
    String payload;
    try {
      payload = cipher.decryptToString(token);
    } catch (DecryptionException e) {
      return Verdict.UNDECRYPTABLE;
    }
    String[] parts = payload.split(SEPARATOR, -1);
    if (parts.length != 3) {
      return Verdict.MALFORMED;
    }
    long issuedAt;
    try {
      issuedAt = Long.parseLong(parts[2]);
    } catch (NumberFormatException e) {
      return Verdict.MALFORMED;
    }
    if (!MessageDigest.isEqual(parts[1].getBytes(StandardCharsets.UTF_8),
        sessionKey.getBytes(StandardCharsets.UTF_8))) {
      return Verdict.SESSION_MISMATCH;
    }
    long ageMillis = clock.millis() - issuedAt;
    if (expirySeconds < 0 || ageMillis / 1000 >= expirySeconds) {
      return Verdict.EXPIRED;
    }
    return Verdict.VALID;
  }
}
