package com.codeheadsystems.vigil.server.fraud;

import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import com.codeheadsystems.vigil.model.device.DeviceFingerprint;

/**
 * Optional collaborator consulted before a verifier runs. When it says block, no verifier is
 * invoked.
 * <p>
 * A {@link RuntimeException} thrown from {@link #assess} is logged and the attempt proceeds
 * without a block check.
 */
public interface FraudSignalAssessor {

  /**
   * Assesses an attempt.
   *
   * @param identity    the identity
   * @param fingerprint the device fingerprint, null if none was supplied
   * @param context     the attempt context
   * @return the assessment
   */
  FraudAssessment assess(AuthIdentity identity, DeviceFingerprint fingerprint, AuthContext context);
}
