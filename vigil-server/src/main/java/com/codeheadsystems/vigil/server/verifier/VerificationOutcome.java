package com.codeheadsystems.vigil.server.verifier;

import com.codeheadsystems.vigil.model.auth.ErrorKind;
import java.time.Duration;
import java.util.Objects;

/**
 * What a single verifier decided.
 *
 * @param status            verified, rejected, or waiting on an out-of-band step
 * @param errorKind         why it was rejected, null otherwise
 * @param lockoutRemaining  remaining method lockout, null if none
 * @param attemptsRemaining attempts left on the credential or challenge, null if not tracked
 * @param challengeToken    the push challenge token while pending, null otherwise
 */
public record VerificationOutcome(Status status,
                                  ErrorKind errorKind,
                                  Duration lockoutRemaining,
                                  Integer attemptsRemaining,
                                  String challengeToken) {

  public VerificationOutcome {
    Objects.requireNonNull(status, "status");
    if (status == Status.REJECTED && errorKind == null) {
      throw new IllegalArgumentException("rejected outcome needs an error kind");
    }
  }

  public static VerificationOutcome verified() {
    return new VerificationOutcome(Status.VERIFIED, null, null, null, null);
  }

  public static VerificationOutcome pending(String challengeToken) {
    return new VerificationOutcome(Status.PENDING, null, null, null, challengeToken);
  }

  public static VerificationOutcome rejected(ErrorKind errorKind) {
    return new VerificationOutcome(Status.REJECTED, errorKind, null, null, null);
  }

  public static VerificationOutcome mismatch(int attemptsRemaining) {
    return new VerificationOutcome(Status.REJECTED, ErrorKind.CREDENTIAL_MISMATCH, null,
        attemptsRemaining, null);
  }

  public static VerificationOutcome lockedOut(Duration remaining) {
    return new VerificationOutcome(Status.REJECTED, ErrorKind.CREDENTIAL_LOCKED_OUT, remaining, 0,
        null);
  }

  public boolean isVerified() {
    return status == Status.VERIFIED;
  }

  /**
   * Verification status.
   */
  public enum Status {
    VERIFIED,
    REJECTED,
    PENDING
  }
}
