package com.codeheadsystems.vigil.server.verifier;

import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Hardware-backed authenticator of the user's device (biometric sensor, security key).
 * <p>
 * Both operations complete asynchronously; an empty result means the user cancelled. The
 * verifier bounds every wait by the configured platform timeout and cancels the future when it
 * gives up.
 */
public interface PlatformAuthenticator {

  boolean isAvailable();

  /**
   * Asks the authenticator to sign a challenge.
   *
   * @param identity     the identity
   * @param credentialId the enrolled credential
   * @param challenge    random challenge to echo
   * @return the assertion, or empty if cancelled
   */
  CompletableFuture<Optional<PlatformAssertion>> requestAssertion(AuthIdentity identity,
                                                                  String credentialId,
                                                                  byte[] challenge);

  /**
   * Asks the authenticator to create a credential.
   *
   * @param identity    the identity
   * @param displayName label for the credential
   * @param challenge   random challenge
   * @return the new credential id, or empty if cancelled
   */
  CompletableFuture<Optional<String>> createCredential(AuthIdentity identity, String displayName,
                                                       byte[] challenge);
}
