package com.codeheadsystems.vigil.server.verifier;

import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import com.codeheadsystems.vigil.model.auth.AuthMethod;
import com.codeheadsystems.vigil.model.auth.AuthRequest;

/**
 * Validates the proof for a single authentication method, without knowledge of the others.
 * <p>
 * Implementations report every expected failure as a rejected {@link VerificationOutcome} and
 * must be thread-safe. A {@link RuntimeException} escaping {@link #verify} is treated by the
 * orchestrator as a provider failure.
 */
public interface CredentialVerifier {

  AuthMethod method();

  /**
   * Verifies one attempt.
   *
   * @param identity the identity
   * @param request  the request, carrying the credential where the method needs one
   * @return the outcome
   */
  VerificationOutcome verify(AuthIdentity identity, AuthRequest request);

  /**
   * Whether the identity has something to verify against for this method.
   *
   * @param identity the identity
   * @return true if enrolled
   */
  boolean isEnrolled(AuthIdentity identity);
}
