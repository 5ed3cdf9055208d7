package com.codeheadsystems.vigil.model.auth;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Opaque user identifier. Every rate-limit bucket, session and credential lockout is keyed by
 * this value, never by transient request data.
 *
 * @param value the identifier, never blank
 */
public record AuthIdentity(@JsonValue String value) {

  public AuthIdentity {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("identity must not be blank");
    }
  }

  /**
   * Of auth identity.
   *
   * @param value the value
   * @return the auth identity
   */
  @JsonCreator
  public static AuthIdentity of(String value) {
    return new AuthIdentity(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
