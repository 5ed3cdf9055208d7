package com.codeheadsystems.vigil.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

/**
 * A time-bounded authenticated session.
 * <p>
 * A session is valid exactly while it is active and {@code now <= expiresAt}.
 *
 * @param token          opaque, unguessable session token
 * @param identity       the authenticated identity
 * @param method         the method the session was established with
 * @param createdAt      creation time
 * @param lastActivityAt time of the last successful validation
 * @param expiresAt      expiry time
 * @param active         false once revoked
 */
public record AuthSession(
    @JsonProperty("token") String token,
    @JsonProperty("identity") AuthIdentity identity,
    @JsonProperty("method") AuthMethod method,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("lastActivityAt") Instant lastActivityAt,
    @JsonProperty("expiresAt") Instant expiresAt,
    @JsonProperty("active") boolean active) {

  public AuthSession {
    Objects.requireNonNull(token, "token");
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(lastActivityAt, "lastActivityAt");
    Objects.requireNonNull(expiresAt, "expiresAt");
  }

  public boolean isExpiredAt(Instant now) {
    return now.isAfter(expiresAt);
  }

  public boolean isValidAt(Instant now) {
    return active && !isExpiredAt(now);
  }

  public AuthSession withLastActivityAt(Instant instant) {
    return new AuthSession(token, identity, method, createdAt, instant, expiresAt, active);
  }

  public AuthSession withExpiresAt(Instant instant) {
    return new AuthSession(token, identity, method, createdAt, lastActivityAt, instant, active);
  }
}
