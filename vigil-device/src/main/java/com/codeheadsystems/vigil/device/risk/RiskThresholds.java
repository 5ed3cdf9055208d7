package com.codeheadsystems.vigil.device.risk;

import com.codeheadsystems.vigil.model.device.RiskLevel;

/**
 * Score thresholds for the qualitative risk levels: {@code low < medium <= score < high <= score}.
 *
 * @param medium lowest score rated medium
 * @param high   lowest score rated high
 */
public record RiskThresholds(double medium, double high) {

  public static final RiskThresholds DEFAULT = new RiskThresholds(0.3, 0.6);

  public RiskThresholds {
    if (medium < 0.0 || medium > 1.0 || high < 0.0 || high > 1.0) {
      throw new IllegalArgumentException("thresholds must be in [0,1]");
    }
    if (medium > high) {
      throw new IllegalArgumentException("medium threshold " + medium + " exceeds high " + high);
    }
  }

  public RiskLevel levelFor(double score) {
    if (score >= high) {
      return RiskLevel.HIGH;
    }
    if (score >= medium) {
      return RiskLevel.MEDIUM;
    }
    return RiskLevel.LOW;
  }
}
