package com.codeheadsystems.vigil.server.fraud;

import java.util.List;

/**
 * Verdict of a {@link FraudSignalAssessor}.
 *
 * @param shouldBlock    veto the attempt
 * @param riskScore      score in [0,1]
 * @param anomalies      what looked wrong
 * @param requiresReview flag for manual review without blocking
 */
public record FraudAssessment(boolean shouldBlock,
                              double riskScore,
                              List<String> anomalies,
                              boolean requiresReview) {

  public FraudAssessment {
    anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
  }

  public static FraudAssessment clear() {
    return new FraudAssessment(false, 0.0, List.of(), false);
  }
}
