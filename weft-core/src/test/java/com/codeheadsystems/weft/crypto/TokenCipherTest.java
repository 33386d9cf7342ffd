package com.codeheadsystems.weft.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TokenCipherTest {

  private static final String KEY_HEX = "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f";

  private TokenCipher cipher;

  @BeforeEach
  void setUp() {
    cipher = TokenCipher.fromHex(KEY_HEX);
  }

  @Test
  void encryptAndDecrypt_roundTrip() {
    String token = cipher.encrypt("secret::session-key");
    assertThat(cipher.decryptToString(token)).isEqualTo("secret::session-key");
  }

  @Test
  void encrypt_samePlaintextTwice_producesDifferentTokens() {
    assertThat(cipher.encrypt("same")).isNotEqualTo(cipher.encrypt("same"));
  }

  @Test
  void encrypt_emptyPlaintext_roundTrips() {
    assertThat(cipher.decrypt(cipher.encrypt(new byte[0]))).isEmpty();
  }

  @Test
  void decrypt_differentKey_throws() {
    String token = cipher.encrypt("payload");
    TokenCipher other = TokenCipher.random();

    assertThatThrownBy(() -> other.decrypt(token)).isInstanceOf(DecryptionException.class);
  }

  @Test
  void decrypt_tamperedCiphertext_throws() {
    byte[] raw = Base64.getUrlDecoder().decode(cipher.encrypt("payload"));
    raw[raw.length - 1] ^= 0x01;
    String tampered = Base64.getUrlEncoder().withoutPadding().encodeToString(raw);

    assertThatThrownBy(() -> cipher.decrypt(tampered)).isInstanceOf(DecryptionException.class);
  }

  @Test
  void decrypt_tamperedNonce_throws() {
    byte[] raw = Base64.getUrlDecoder().decode(cipher.encrypt("payload"));
    raw[3] ^= 0x01;
    String tampered = Base64.getUrlEncoder().withoutPadding().encodeToString(raw);

    assertThatThrownBy(() -> cipher.decrypt(tampered)).isInstanceOf(DecryptionException.class);
  }

  @Test
  void decrypt_truncated_throws() {
    String token = cipher.encrypt("payload");
    assertThatThrownBy(() -> cipher.decrypt(token.substring(0, 10)))
        .isInstanceOf(DecryptionException.class);
  }

  @Test
  void decrypt_garbage_throws() {
    assertThatThrownBy(() -> cipher.decrypt("badtoken")).isInstanceOf(DecryptionException.class);
    assertThatThrownBy(() -> cipher.decrypt("***not base64***")).isInstanceOf(DecryptionException.class);
    assertThatThrownBy(() -> cipher.decrypt("")).isInstanceOf(DecryptionException.class);
    assertThatThrownBy(() -> cipher.decrypt(null)).isInstanceOf(DecryptionException.class);
  }

  @Test
  void fromSecret_sameSecret_derivesSameKey() {
    String token = TokenCipher.fromSecret("correct-horse-battery-staple").encrypt("payload");

    assertThat(TokenCipher.fromSecret("correct-horse-battery-staple").decryptToString(token))
        .isEqualTo("payload");
    assertThatThrownBy(() -> TokenCipher.fromSecret("another-passphrase").decrypt(token))
        .isInstanceOf(DecryptionException.class);
  }

  @Test
  void fromHex_wrongLength_throws() {
    assertThatThrownBy(() -> TokenCipher.fromHex("abcd")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> TokenCipher.fromHex("zz")).isInstanceOf(IllegalArgumentException.class);
  }
}
