package com.codeheadsystems.vigil.server.manager;

import com.codeheadsystems.vigil.model.auth.AuthSession;
import java.util.Optional;

/**
 * Result of validating a session token.
 *
 * @param status  what was found
 * @param session the session when valid or just expired, otherwise null
 */
public record SessionValidation(Status status, AuthSession session) {

  static final SessionValidation NOT_FOUND = new SessionValidation(Status.NOT_FOUND, null);

  static SessionValidation valid(AuthSession session) {
    return new SessionValidation(Status.VALID, session);
  }

  static SessionValidation expired(AuthSession session) {
    return new SessionValidation(Status.EXPIRED, session);
  }

  /**
   * The session, only if it is valid.
   *
   * @return the optional
   */
  public Optional<AuthSession> asOptional() {
    return status == Status.VALID ? Optional.ofNullable(session) : Optional.empty();
  }

  /**
   * The status.
   */
  public enum Status {
    VALID,
    /**
     * The token was known but past its expiry; it has been revoked.
     */
    EXPIRED,
    NOT_FOUND
  }
}
