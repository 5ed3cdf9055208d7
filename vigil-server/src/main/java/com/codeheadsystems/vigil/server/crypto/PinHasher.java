package com.codeheadsystems.vigil.server.crypto;

import org.bouncycastle.util.Arrays;

/**
 * Salted one-way hash for PINs.
 */
public interface PinHasher {

  /**
   * Hashes a PIN.
   *
   * @param pin  the PIN digits
   * @param salt the per-credential salt
   * @return the hash
   */
  byte[] hash(String pin, byte[] salt);

  /**
   * Constant-time check of a PIN against a stored hash.
   *
   * @param pin          the candidate PIN
   * @param salt         the stored salt
   * @param expectedHash the stored hash
   * @return true if the PIN matches
   */
  default boolean matches(String pin, byte[] salt, byte[] expectedHash) {
    return Arrays.constantTimeAreEqual(hash(pin, salt), expectedHash);
  }
}
