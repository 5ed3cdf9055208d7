package com.codeheadsystems.vigil.server.crypto;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random generation. Used for
 * session and challenge tokens, PIN salts and one-time codes.
 */
public record RandomProvider(SecureRandom random) {

  private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /**
   * Unpadded base64url encoding of {@code len} random bytes.
   *
   * @param len the number of random bytes
   * @return the token
   */
  public String randomToken(int len) {
    return URL_ENCODER.encodeToString(randomBytes(len));
  }

  /**
   * Uniformly random decimal digits, leading zeros included.
   *
   * @param count the number of digits
   * @return the digits
   */
  public String randomDigits(int count) {
    StringBuilder digits = new StringBuilder(count);
    for (int i = 0; i < count; i++) {
      digits.append((char) ('0' + random.nextInt(10)));
    }
    return digits.toString();
  }
}
