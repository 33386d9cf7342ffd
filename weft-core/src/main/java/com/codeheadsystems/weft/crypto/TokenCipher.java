package com.codeheadsystems.weft.crypto;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.modes.GCMModeCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Symmetric authenticated encryption of opaque strings, keyed by a process-wide secret.
 * <p>
 * Tokens are AES-256-GCM: {@code base64url(version || nonce || ciphertext || tag)} with a fresh
 * 96-bit nonce per call. The GCM tag covers the version byte and nonce, so any modification,
 * truncation, or use of a different key fails decryption with {@link DecryptionException}.
 * <p>
 * No structure is imposed on the plaintext; callers serialize their own payloads.
 * Instances are thread-safe.
 */
public class TokenCipher {

  private static final Logger log = LoggerFactory.getLogger(TokenCipher.class);

  /**
   * Required key length in bytes (AES-256).
   */
  public static final int KEY_LENGTH = 32;

  private static final byte VERSION = 0x01;
  private static final int NONCE_LENGTH = 12;
  private static final int TAG_BITS = 128;
  private static final int HEADER_LENGTH = 1 + NONCE_LENGTH;
  private static final int MIN_TOKEN_LENGTH = HEADER_LENGTH + TAG_BITS / 8;
  private static final byte[] HKDF_INFO = "weft-token-cipher-v1".getBytes(StandardCharsets.US_ASCII);

  private static final Base64.Encoder B64 = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder B64D = Base64.getUrlDecoder();

  private final byte[] key;
  private final SecureRandom random;

  /**
   * Creates a cipher with the given 32-byte key.
   *
   * @param key    the AES-256 key
   * @param random source of nonces
   */
  public TokenCipher(byte[] key, SecureRandom random) {
    if (key == null || key.length != KEY_LENGTH) {
      throw new IllegalArgumentException("Token cipher key must be " + KEY_LENGTH + " bytes");
    }
    this.key = key.clone();
    this.random = random;
  }

  /**
   * Creates a cipher from a hex-encoded 32-byte key.
   *
   * @param keyHex the hex key
   * @return the token cipher
   */
  public static TokenCipher fromHex(String keyHex) {
    byte[] key;
    try {
      key = HexFormat.of().parseHex(keyHex);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Secret key is not valid hex", e);
    }
    return new TokenCipher(key, new SecureRandom());
  }

  /**
   * Derives a key from an arbitrary passphrase with HKDF-SHA256.
   *
   * @param secret the secret
   * @return the token cipher
   */
  public static TokenCipher fromSecret(String secret) {
    if (secret == null || secret.isEmpty()) {
      throw new IllegalArgumentException("Secret must not be empty");
    }
    HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
    hkdf.init(new HKDFParameters(secret.getBytes(StandardCharsets.UTF_8), null, HKDF_INFO));
    byte[] key = new byte[KEY_LENGTH];
    hkdf.generateBytes(key, 0, KEY_LENGTH);
    return new TokenCipher(key, new SecureRandom());
  }

  /**
   * Creates a cipher with a random key. Tokens do not survive a restart.
   *
   * @return the token cipher
   */
  public static TokenCipher random() {
    SecureRandom random = new SecureRandom();
    byte[] key = new byte[KEY_LENGTH];
    random.nextBytes(key);
    return new TokenCipher(key, random);
  }

  /**
   * Encrypts the UTF-8 bytes of the given string.
   *
   * @param plaintext the plaintext
   * @return the opaque token
   */
  public String encrypt(String plaintext) {
    return encrypt(plaintext.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Encrypts the given bytes.
   *
   * @param plaintext the plaintext
   * @return the opaque token
   */
  public String encrypt(byte[] plaintext) {
    byte[] nonce = new byte[NONCE_LENGTH];
    random.nextBytes(nonce);
    byte[] header = new byte[HEADER_LENGTH];
    header[0] = VERSION;
    System.arraycopy(nonce, 0, header, 1, NONCE_LENGTH);

    GCMModeCipher cipher = newCipher(true, nonce, header);
    byte[] out = new byte[HEADER_LENGTH + cipher.getOutputSize(plaintext.length)];
    System.arraycopy(header, 0, out, 0, HEADER_LENGTH);
    int len = cipher.processBytes(plaintext, 0, plaintext.length, out, HEADER_LENGTH);
    try {
      cipher.doFinal(out, HEADER_LENGTH + len);
    } catch (InvalidCipherTextException e) {
      // GCM never reports this while encrypting.
      throw new IllegalStateException("Encryption failed", e);
    }
    return B64.encodeToString(out);
  }

  /**
   * Decrypts a token produced by {@link #encrypt(byte[])}.
   *
   * @param token the token
   * @return the plaintext bytes
   * @throws DecryptionException if the token is malformed or fails authentication
   */
  public byte[] decrypt(String token) {
    if (token == null || token.isBlank()) {
      throw new DecryptionException("Token is empty");
    }
    byte[] raw;
    try {
      raw = B64D.decode(token.trim());
    } catch (IllegalArgumentException e) {
      throw new DecryptionException("Token is not valid base64url", e);
    }
    if (raw.length < MIN_TOKEN_LENGTH) {
      throw new DecryptionException("Token is truncated");
    }
    if (raw[0] != VERSION) {
      throw new DecryptionException("Unsupported token version " + raw[0]);
    }
    byte[] header = Arrays.copyOfRange(raw, 0, HEADER_LENGTH);
    byte[] nonce = Arrays.copyOfRange(raw, 1, HEADER_LENGTH);

    GCMModeCipher cipher = newCipher(false, nonce, header);
    int bodyLength = raw.length - HEADER_LENGTH;
    byte[] plain = new byte[cipher.getOutputSize(bodyLength)];
    int len = cipher.processBytes(raw, HEADER_LENGTH, bodyLength, plain, 0);
    try {
      len += cipher.doFinal(plain, len);
    } catch (InvalidCipherTextException e) {
      log.debug("Token failed authentication: {}", e.getMessage());
      throw new DecryptionException("Token failed authentication", e);
    }
    return len == plain.length ? plain : Arrays.copyOf(plain, len);
  }

  /**
   * Decrypts a token and decodes the plaintext as UTF-8.
   *
   * @param token the token
   * @return the plaintext string
   * @throws DecryptionException if the token is malformed or fails authentication
   */
  public String decryptToString(String token) {
    return new String(decrypt(token), StandardCharsets.UTF_8);
  }

  private GCMModeCipher newCipher(boolean forEncryption, byte[] nonce, byte[] associatedData) {
    GCMModeCipher cipher = GCMBlockCipher.newInstance(AESEngine.newInstance());
    cipher.init(forEncryption, new AEADParameters(new KeyParameter(key), TAG_BITS, nonce, associatedData));
    return cipher;
  }
}
