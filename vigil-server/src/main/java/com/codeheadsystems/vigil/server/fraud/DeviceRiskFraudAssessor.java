package com.codeheadsystems.vigil.server.fraud;

import com.codeheadsystems.vigil.device.risk.RiskScorer;
import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import com.codeheadsystems.vigil.model.device.DeviceFingerprint;
import com.codeheadsystems.vigil.model.device.DeviceRiskAssessment;
import com.codeheadsystems.vigil.model.device.RiskLevel;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link FraudSignalAssessor} driven only by device risk: blocks at {@code blockLevel} and asks
 * for review one level below it. Attempts without a fingerprint pass.
 */
public class DeviceRiskFraudAssessor implements FraudSignalAssessor {

  private static final Logger log = LoggerFactory.getLogger(DeviceRiskFraudAssessor.class);

  private final RiskScorer riskScorer;
  private final RiskLevel blockLevel;

  public DeviceRiskFraudAssessor(final RiskScorer riskScorer, final RiskLevel blockLevel) {
    log.info("DeviceRiskFraudAssessor(blockLevel={})", blockLevel);
    this.riskScorer = Objects.requireNonNull(riskScorer, "riskScorer");
    this.blockLevel = Objects.requireNonNull(blockLevel, "blockLevel");
  }

  @Override
  public FraudAssessment assess(AuthIdentity identity, DeviceFingerprint fingerprint,
                                AuthContext context) {
    if (fingerprint == null) {
      return FraudAssessment.clear();
    }
    DeviceRiskAssessment risk = context != null && context.deviceRisk() != null
        ? context.deviceRisk()
        : riskScorer.assess(fingerprint);
    boolean block = risk.level().isAtLeast(blockLevel);
    boolean review = !block && blockLevel.ordinal() > 0
        && risk.level().ordinal() == blockLevel.ordinal() - 1;
    if (block) {
      log.info("Blocking identity={} on device risk {} ({})", identity, risk.score(), risk.level());
    }
    return new FraudAssessment(block, risk.score(), risk.reasons(), review);
  }
}
