package com.codeheadsystems.vigil.server.verifier;

import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import java.time.Instant;

/**
 * A registered platform credential.
 *
 * @param identity     the identity
 * @param credentialId authenticator-assigned id
 * @param displayName  label shown to the user
 * @param createdAt    enrollment time
 */
public record PlatformCredential(AuthIdentity identity, String credentialId, String displayName,
                                 Instant createdAt) {
}
