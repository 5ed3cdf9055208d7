package com.codeheadsystems.vigil.model.event;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Kinds of audit events emitted by the engine.
 */
public enum SecurityEventKind {
  AUTH_SUCCESS,
  AUTH_FAILURE,
  PIN_LOCKOUT,
  OTP_LOCKOUT,
  ACCOUNT_LOCKED,
  FRAUD_DETECTED,
  RATE_LIMITED,
  SESSION_EXPIRED,
  SESSION_REVOKED,
  OTP_SENT,
  OTP_VERIFIED,
  PUSH_SENT,
  PUSH_RESOLVED,
  PIN_ENROLLED,
  BIOMETRIC_ENROLLED;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
