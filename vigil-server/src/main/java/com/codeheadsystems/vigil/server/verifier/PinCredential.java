package com.codeheadsystems.vigil.server.verifier;

import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Stored PIN. The hash is never compared or kept in plaintext form.
 * <p>
 * Equality compares the hash and salt by content, so compare-and-set works against stores that
 * hand back copies.
 *
 * @param identity       the identity
 * @param hash           salted Argon2id hash
 * @param salt           per-credential salt
 * @param failedAttempts consecutive wrong PINs
 * @param lockedUntil    end of the current lockout, null if not locked
 */
public record PinCredential(AuthIdentity identity,
                            byte[] hash,
                            byte[] salt,
                            int failedAttempts,
                            Instant lockedUntil) {

  public PinCredential {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(hash, "hash");
    Objects.requireNonNull(salt, "salt");
  }

  PinCredential withFailure(int attempts, Instant lockUntil) {
    return new PinCredential(identity, hash, salt, attempts, lockUntil);
  }

  PinCredential cleared() {
    return new PinCredential(identity, hash, salt, 0, null);
  }

  public boolean isLockedAt(Instant now) {
    return lockedUntil != null && now.isBefore(lockedUntil);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof PinCredential other
        && failedAttempts == other.failedAttempts
        && identity.equals(other.identity)
        && Arrays.equals(hash, other.hash)
        && Arrays.equals(salt, other.salt)
        && Objects.equals(lockedUntil, other.lockedUntil);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(identity, failedAttempts, lockedUntil);
    result = 31 * result + Arrays.hashCode(hash);
    return 31 * result + Arrays.hashCode(salt);
  }

  @Override
  public String toString() {
    return "PinCredential[identity=" + identity + ", failedAttempts=" + failedAttempts
        + ", lockedUntil=" + lockedUntil + "]";
  }
}
