package com.codeheadsystems.vigil.device.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.vigil.device.DeviceSignalsFixtures;
import com.codeheadsystems.vigil.model.device.DeviceFingerprint;
import com.codeheadsystems.vigil.model.device.DeviceRiskAssessment;
import com.codeheadsystems.vigil.model.device.DeviceSignals;
import com.codeheadsystems.vigil.model.device.RiskLevel;
import java.time.Instant;
import java.util.List;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.Test;

class RiskScorerTest {

  private final RiskScorer scorer = new RiskScorer(RiskThresholds.DEFAULT);

  private static DeviceFingerprint fingerprint(DeviceSignals signals, double confidence) {
    return new DeviceFingerprint("id", signals, confidence, Instant.EPOCH);
  }

  private static DeviceFingerprint clean() {
    return fingerprint(DeviceSignalsFixtures.desktop(), 1.0);
  }

  @Test
  void assess_cleanDevice_isLowWithNoReasons() {
    DeviceRiskAssessment assessment = scorer.assess(clean());

    assertThat(assessment.score()).isZero();
    assertThat(assessment.level()).isEqualTo(RiskLevel.LOW);
    assertThat(assessment.reasons()).isEmpty();
  }

  @Test
  void assess_anonymityTool_isMedium() {
    DeviceSignals tor = DeviceSignalsFixtures.desktop().toBuilder()
        .userAgent("Mozilla/5.0 (Windows NT 10.0; rv:115.0) Gecko/20100101 Firefox/115.0 Tor")
        .build();

    DeviceRiskAssessment assessment = scorer.assess(fingerprint(tor, 1.0));

    assertThat(assessment.score()).isEqualTo(0.3);
    assertThat(assessment.level()).isEqualTo(RiskLevel.MEDIUM);
    assertThat(assessment.reasons()).containsExactly(RiskIndicator.ANONYMITY_TOOL.reason());
  }

  @Test
  void assess_emptySignals_matchesEveryIndicatorExceptAnonymity() {
    DeviceRiskAssessment assessment = scorer.assess(fingerprint(DeviceSignals.builder().build(), 0.0));

    assertThat(assessment.score()).isEqualTo(0.7);
    assertThat(assessment.level()).isEqualTo(RiskLevel.HIGH);
    assertThat(assessment.reasons()).hasSize(4);
  }

  @Test
  void assess_everyIndicator_isClampedToOne() {
    DeviceSignals worst = DeviceSignals.builder().userAgent("VPN client").build();

    DeviceRiskAssessment assessment = scorer.assess(fingerprint(worst, 0.1));

    assertThat(assessment.score()).isEqualTo(1.0);
    assertThat(scorer.indicators(fingerprint(worst, 0.1))).containsExactly(RiskIndicator.values());
  }

  @Test
  void assess_addingAnyIndicator_neverDecreasesScore() {
    DeviceFingerprint base = clean();
    double baseScore = scorer.assess(base).score();
    List<UnaryOperator<DeviceFingerprint>> additions = List.of(
        fp -> fingerprint(fp.signals().toBuilder().userAgent(fp.signals().userAgent() + " Tor").build(), fp.confidence()),
        fp -> fingerprint(fp.signals().toBuilder().screen(new DeviceSignals.ScreenInfo(800, 600, 24, 1.0)).build(), fp.confidence()),
        fp -> fingerprint(fp.signals(), 0.4),
        fp -> fingerprint(fp.signals().toBuilder().hardware(new DeviceSignals.HardwareInfo(8, 0, 0)).build(), fp.confidence()),
        fp -> fingerprint(fp.signals().toBuilder().renderEngine(new DeviceSignals.RenderEngineInfo("unknown", "unknown")).build(), fp.confidence()));

    for (UnaryOperator<DeviceFingerprint> addition : additions) {
      DeviceFingerprint riskier = addition.apply(base);
      assertThat(scorer.assess(riskier).score()).isGreaterThan(baseScore);
      // stacking on top of an already risky device still does not lower the score
      DeviceFingerprint lowRes = additions.get(1).apply(base);
      assertThat(scorer.assess(addition.apply(lowRes)).score())
          .isGreaterThanOrEqualTo(scorer.assess(lowRes).score());
    }
  }

  @Test
  void thresholds_levelBoundaries() {
    RiskThresholds thresholds = RiskThresholds.DEFAULT;
    assertThat(thresholds.levelFor(0.29)).isEqualTo(RiskLevel.LOW);
    assertThat(thresholds.levelFor(0.3)).isEqualTo(RiskLevel.MEDIUM);
    assertThat(thresholds.levelFor(0.59)).isEqualTo(RiskLevel.MEDIUM);
    assertThat(thresholds.levelFor(0.6)).isEqualTo(RiskLevel.HIGH);
  }

  @Test
  void thresholds_outOfOrder_throws() {
    assertThatThrownBy(() -> new RiskThresholds(0.7, 0.5))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new RiskThresholds(-0.1, 0.5))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
