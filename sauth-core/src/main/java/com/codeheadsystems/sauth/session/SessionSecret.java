package com.codeheadsystems.sauth.session;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Symmetric key used to sign session tokens.
 * <p>
 * A secret is created once by whatever composes the gate and handed to every
 * {@link SessionTokenManager} that needs it. Generated secrets live only in memory, so all
 * previously issued sessions become invalid when the process restarts.
 */
public final class SessionSecret {

  /**
   * Minimum accepted key length in bytes (128 bits).
   */
  public static final int MIN_LENGTH = 16;

  /**
   * Length of generated keys in bytes (256 bits, the HMAC-SHA256 block-friendly size).
   */
  public static final int GENERATED_LENGTH = 32;

  private final byte[] key;

  private SessionSecret(byte[] key) {
    if (key.length < MIN_LENGTH) {
      throw new IllegalArgumentException(
          "Session secret must be at least " + MIN_LENGTH + " bytes, got " + key.length);
    }
    this.key = key.clone();
  }

  /**
   * Generates a fresh random secret.
   *
   * @param secureRandom the source of randomness
   * @return the session secret
   */
  public static SessionSecret generate(SecureRandom secureRandom) {
    Objects.requireNonNull(secureRandom, "secureRandom");
    byte[] key = new byte[GENERATED_LENGTH];
    secureRandom.nextBytes(key);
    return new SessionSecret(key);
  }

  /**
   * Wraps an operator supplied hex-encoded key.
   *
   * @param hex hex-encoded key of at least {@value #MIN_LENGTH} bytes
   * @return the session secret
   */
  public static SessionSecret fromHex(String hex) {
    Objects.requireNonNull(hex, "hex");
    return new SessionSecret(HexFormat.of().parseHex(hex));
  }

  /**
   * Copy of the key bytes.
   *
   * @return the key
   */
  public byte[] bytes() {
    return key.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SessionSecret other && Arrays.equals(key, other.key);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(key);
  }

  @Override
  public String toString() {
    return "SessionSecret[" + key.length + " bytes]";
  }
}
