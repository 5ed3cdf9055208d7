package com.codeheadsystems.vigil.server.verifier;

import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import java.time.Instant;

/**
 * A push approval request.
 *
 * @param token     opaque challenge token
 * @param identity  the identity being authenticated
 * @param createdAt issue time
 * @param expiresAt expiry time
 * @param status    current status; only {@code PENDING} can change
 */
public record PushChallenge(String token,
                            AuthIdentity identity,
                            Instant createdAt,
                            Instant expiresAt,
                            Status status) {

  PushChallenge withStatus(Status newStatus) {
    return new PushChallenge(token, identity, createdAt, expiresAt, newStatus);
  }

  /**
   * Challenge status.
   */
  public enum Status {
    PENDING,
    APPROVED,
    DENIED,
    EXPIRED,
    /**
     * Dispatch failed; can never be approved.
     */
    FAILED
  }
}
