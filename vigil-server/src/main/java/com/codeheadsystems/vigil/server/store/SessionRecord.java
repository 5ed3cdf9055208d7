package com.codeheadsystems.vigil.server.store;

import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import com.codeheadsystems.vigil.model.auth.AuthMethod;
import java.time.Instant;

/**
 * Durable mirror of a session.
 *
 * @param token     the session token
 * @param identity  the identity
 * @param method    the method the session was established with
 * @param createdAt creation time
 * @param expiresAt expiry time
 */
public record SessionRecord(String token,
                            AuthIdentity identity,
                            AuthMethod method,
                            Instant createdAt,
                            Instant expiresAt) {
}
