package com.codeheadsystems.vigil.model.auth;

/**
 * State reached by a single authentication attempt.
 * <p>
 * {@link #AWAITING_NEXT_METHOD} and {@link #AWAITING_VERIFICATION} are the only non-terminal
 * states: the caller is expected to continue with another method or to wait for an
 * out-of-band approval.
 */
public enum AuthState {
  AUTHENTICATED,
  AWAITING_NEXT_METHOD,
  AWAITING_VERIFICATION,
  LOCKED_OUT,
  RATE_LIMITED,
  BLOCKED,
  FAILED;

  public boolean isTerminal() {
    return this != AWAITING_NEXT_METHOD && this != AWAITING_VERIFICATION;
  }
}
