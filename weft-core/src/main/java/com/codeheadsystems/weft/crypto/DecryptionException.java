package com.codeheadsystems.weft.crypto;

/**
 * Thrown when a token cannot be decrypted: it is malformed, truncated, tampered with, or was
 * produced under a different key.
 * <p>
 * Callers must treat this as "invalid token", never as a server error.
 */
public class DecryptionException extends RuntimeException {

  /**
   * Instantiates a new Decryption exception.
   *
   * @param message the message
   */
  public DecryptionException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Decryption exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public DecryptionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
