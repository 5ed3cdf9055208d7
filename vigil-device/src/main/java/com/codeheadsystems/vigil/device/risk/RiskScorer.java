package com.codeheadsystems.vigil.device.risk;

import com.codeheadsystems.vigil.model.device.DeviceFingerprint;
import com.codeheadsystems.vigil.model.device.DeviceRiskAssessment;
import com.codeheadsystems.vigil.model.device.DeviceSignals;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Additive rule-based device risk. Each matched {@link RiskIndicator} adds its weight and its
 * reason; the score is clamped to 1.0. Pure and deterministic.
 */
@Singleton
public class RiskScorer {

  private static final Logger log = LoggerFactory.getLogger(RiskScorer.class);

  static final int MIN_WIDTH = 1024;
  static final int MIN_HEIGHT = 768;
  static final double MIN_CONFIDENCE = 0.5;

  private final RiskThresholds thresholds;

  @Inject
  public RiskScorer(final RiskThresholds thresholds) {
    log.info("RiskScorer(medium={}, high={})", thresholds.medium(), thresholds.high());
    this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
  }

  /**
   * Assess device risk assessment.
   *
   * @param fingerprint the fingerprint
   * @return the device risk assessment
   */
  public DeviceRiskAssessment assess(DeviceFingerprint fingerprint) {
    Set<RiskIndicator> matched = indicators(fingerprint);
    int total = matched.stream().mapToInt(RiskIndicator::weight).sum();
    double score = Math.min(100, total) / 100.0;
    List<String> reasons = matched.stream().map(RiskIndicator::reason).toList();
    return new DeviceRiskAssessment(score, thresholds.levelFor(score), reasons);
  }

  /**
   * The indicators a fingerprint matches, in declaration order.
   *
   * @param fingerprint the fingerprint
   * @return the matched indicators
   */
  public Set<RiskIndicator> indicators(DeviceFingerprint fingerprint) {
    Objects.requireNonNull(fingerprint, "fingerprint");
    DeviceSignals s = fingerprint.signals();
    Set<RiskIndicator> matched = EnumSet.noneOf(RiskIndicator.class);
    String userAgent = s.userAgent();
    if (userAgent != null && (userAgent.contains("Tor") || userAgent.contains("VPN"))) {
      matched.add(RiskIndicator.ANONYMITY_TOOL);
    }
    if (s.screen() == null || s.screen().width() < MIN_WIDTH || s.screen().height() < MIN_HEIGHT) {
      matched.add(RiskIndicator.LOW_RESOLUTION);
    }
    if (fingerprint.confidence() < MIN_CONFIDENCE) {
      matched.add(RiskIndicator.LOW_CONFIDENCE);
    }
    if (s.hardware() == null || s.hardware().deviceMemoryGb() == 0) {
      matched.add(RiskIndicator.HARDWARE_MEMORY_UNAVAILABLE);
    }
    String vendor = s.renderEngine() == null ? null : s.renderEngine().vendor();
    if (vendor == null || vendor.isBlank() || "unknown".equals(vendor)) {
      matched.add(RiskIndicator.RENDER_ENGINE_UNAVAILABLE);
    }
    return matched;
  }
}
