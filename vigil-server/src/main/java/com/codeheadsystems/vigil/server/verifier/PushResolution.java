package com.codeheadsystems.vigil.server.verifier;

import java.util.Optional;

/**
 * Result of answering a push challenge.
 *
 * @param challenge the challenge after resolution, null if the token was unknown
 * @param outcome   the outcome
 */
public record PushResolution(PushChallenge challenge, VerificationOutcome outcome) {

  public Optional<PushChallenge> challengeOptional() {
    return Optional.ofNullable(challenge);
  }
}
