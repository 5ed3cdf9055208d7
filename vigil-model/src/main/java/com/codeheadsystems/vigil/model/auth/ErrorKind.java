package com.codeheadsystems.vigil.model.auth;

/**
 * Why an authentication attempt did not succeed. These are returned as values, never thrown.
 */
public enum ErrorKind {
  /**
   * The global per-identity attempt window is exhausted. Retry after the reported delay.
   */
  RATE_LIMIT_EXCEEDED,
  /**
   * The supplied input is malformed, e.g. a non-numeric PIN.
   */
  INVALID_CREDENTIAL_FORMAT,
  /**
   * Wrong PIN, wrong code, rejected or cancelled assertion.
   */
  CREDENTIAL_MISMATCH,
  /**
   * A method-specific lockout is active. Independent of the global rate limit.
   */
  CREDENTIAL_LOCKED_OUT,
  /**
   * The one-time code or push challenge timed out. A new challenge is required.
   */
  CHALLENGE_EXPIRED,
  /**
   * The one-time code or push challenge was already used up.
   */
  CHALLENGE_ALREADY_RESOLVED,
  /**
   * The underlying capability (platform authenticator, push device) is not available.
   */
  TRANSPORT_UNAVAILABLE,
  /**
   * A fraud or device-risk signal vetoed the attempt.
   */
  BLOCKED,
  /**
   * A store, SMS or push provider failed.
   */
  PROVIDER_FAILURE,
  /**
   * The identity has no credential for the requested method.
   */
  NOT_ENROLLED;

  /**
   * Whether the orchestrator should move on to the next method in the fallback chain.
   *
   * @return true if falling back is the appropriate reaction
   */
  public boolean triggersFallback() {
    return switch (this) {
      case CREDENTIAL_MISMATCH, NOT_ENROLLED, TRANSPORT_UNAVAILABLE, CHALLENGE_EXPIRED,
           PROVIDER_FAILURE -> true;
      default -> false;
    };
  }
}
