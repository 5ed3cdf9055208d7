package com.codeheadsystems.vigil.server.verifier;

import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import java.time.Instant;

/**
 * An issued one-time code. Single use: once it leaves {@code ACTIVE} it can never verify again.
 *
 * @param identity    the identity
 * @param phoneNumber where it was sent
 * @param code        the digits
 * @param createdAt   issue time
 * @param expiresAt   expiry time; an exhausted code keeps the identity locked out until then
 * @param attempts    verification attempts so far
 * @param maxAttempts attempts allowed
 * @param status      current status
 */
public record OneTimeCode(AuthIdentity identity,
                          String phoneNumber,
                          String code,
                          Instant createdAt,
                          Instant expiresAt,
                          int attempts,
                          int maxAttempts,
                          Status status) {

  OneTimeCode attempted(Status newStatus) {
    return new OneTimeCode(identity, phoneNumber, code, createdAt, expiresAt, attempts + 1,
        maxAttempts, newStatus);
  }

  OneTimeCode withStatus(Status newStatus) {
    return new OneTimeCode(identity, phoneNumber, code, createdAt, expiresAt, attempts,
        maxAttempts, newStatus);
  }

  public boolean isActive() {
    return status == Status.ACTIVE;
  }

  /**
   * Whether the attempts ran out and the window has not closed yet.
   *
   * @param now the current time
   * @return true while the OTP lockout lasts
   */
  public boolean isLockingAt(Instant now) {
    return status == Status.EXHAUSTED && !now.isAfter(expiresAt);
  }

  @Override
  public String toString() {
    return "OneTimeCode[identity=" + identity + ", expiresAt=" + expiresAt + ", attempts="
        + attempts + "/" + maxAttempts + ", status=" + status + "]";
  }

  /**
   * Code status.
   */
  public enum Status {
    ACTIVE,
    VERIFIED,
    EXPIRED,
    /**
     * Attempts ran out; locks one-time codes for the identity until the code's expiry.
     */
    EXHAUSTED
  }
}
