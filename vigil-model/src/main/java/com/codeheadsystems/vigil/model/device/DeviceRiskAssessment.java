package com.codeheadsystems.vigil.model.device;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

/**
 * Risk computed from a device fingerprint.
 *
 * @param score   additive risk score in [0,1]
 * @param level   qualitative level derived from the score
 * @param reasons one human-readable reason per matched indicator
 */
public record DeviceRiskAssessment(
    @JsonProperty("score") double score,
    @JsonProperty("level") RiskLevel level,
    @JsonProperty("reasons") List<String> reasons) {

  public DeviceRiskAssessment {
    Objects.requireNonNull(level, "level");
    reasons = reasons == null ? List.of() : List.copyOf(reasons);
    if (score < 0.0 || score > 1.0) {
      throw new IllegalArgumentException("score must be in [0,1]: " + score);
    }
  }
}
