package com.codeheadsystems.vigil.springboot.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.codeheadsystems.vigil.model.auth.AuthAttemptResult;
import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import com.codeheadsystems.vigil.model.auth.AuthMethod;
import com.codeheadsystems.vigil.model.auth.AuthRequest;
import com.codeheadsystems.vigil.model.auth.AuthState;
import com.codeheadsystems.vigil.server.config.AuthConfig;
import com.codeheadsystems.vigil.server.event.SecurityEventSink;
import com.codeheadsystems.vigil.server.event.Slf4jSecurityEventSink;
import com.codeheadsystems.vigil.server.fraud.DeviceRiskFraudAssessor;
import com.codeheadsystems.vigil.server.fraud.FraudSignalAssessor;
import com.codeheadsystems.vigil.server.manager.AuthOrchestrator;
import com.codeheadsystems.vigil.server.manager.SessionManager;
import com.codeheadsystems.vigil.server.verifier.OneTimeCodeSender;
import com.codeheadsystems.vigil.server.verifier.PinVerifier;
import com.codeheadsystems.vigil.server.verifier.PlatformAuthenticator;
import com.codeheadsystems.vigil.server.verifier.PlatformVerifier;
import com.codeheadsystems.vigil.server.verifier.PushDispatcher;
import com.codeheadsystems.vigil.server.verifier.PushVerifier;
import com.codeheadsystems.vigil.server.verifier.SmsVerifier;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

/**
 * The type Vigil auto configuration test.
 */
class VigilAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(VigilAutoConfiguration.class))
      .withPropertyValues("vigil.argon2-memory-kib=64", "vigil.argon2-iterations=1");

  @Test
  void defaults_registerEngineWithPinOnly() {
    runner.run(context -> {
      assertThat(context).hasNotFailed();
      assertThat(context).hasSingleBean(AuthOrchestrator.class);
      assertThat(context).hasSingleBean(SessionManager.class);
      assertThat(context).hasSingleBean(PinVerifier.class);
      assertThat(context).doesNotHaveBean(PlatformVerifier.class);
      assertThat(context).doesNotHaveBean(SmsVerifier.class);
      assertThat(context).doesNotHaveBean(PushVerifier.class);
      assertThat(context).doesNotHaveBean(FraudSignalAssessor.class);
      assertThat(context).getBean(SecurityEventSink.class).isInstanceOf(Slf4jSecurityEventSink.class);
    });
  }

  @Test
  void properties_bindIntoAuthConfig() {
    runner.withPropertyValues("vigil.max-pin-attempts=7", "vigil.session-ttl=10m",
            "vigil.fallback-chain=pin,sms")
        .run(context -> {
          AuthConfig config = context.getBean(AuthConfig.class);
          assertThat(config.maxPinAttempts()).isEqualTo(7);
          assertThat(config.sessionTtl()).isEqualTo(Duration.ofMinutes(10));
          assertThat(config.fallbackChain().methods()).containsExactly(AuthMethod.PIN, AuthMethod.SMS);
        });
  }

  @Test
  void providers_registerTheirVerifiers() {
    runner.withBean(PlatformAuthenticator.class, () -> mock(PlatformAuthenticator.class))
        .withBean(OneTimeCodeSender.class, () -> mock(OneTimeCodeSender.class))
        .withBean(PushDispatcher.class, () -> mock(PushDispatcher.class))
        .run(context -> {
          assertThat(context).hasSingleBean(PlatformVerifier.class);
          assertThat(context).hasSingleBean(SmsVerifier.class);
          assertThat(context).hasSingleBean(PushVerifier.class);
          assertThat(context).hasSingleBean(AuthOrchestrator.class);
        });
  }

  @Test
  void userBeans_takePrecedence() {
    Clock fixed = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
    SecurityEventSink sink = mock(SecurityEventSink.class);
    runner.withBean(Clock.class, () -> fixed)
        .withBean(SecurityEventSink.class, () -> sink)
        .run(context -> {
          assertThat(context).hasSingleBean(Clock.class);
          assertThat(context.getBean(Clock.class)).isSameAs(fixed);
          assertThat(context.getBean(SecurityEventSink.class)).isSameAs(sink);
        });
  }

  @Test
  void fraudBlockLevel_registersDeviceRiskAssessor() {
    runner.withPropertyValues("vigil.risk.fraud-block-level=high")
        .run(context -> assertThat(context).getBean(FraudSignalAssessor.class)
            .isInstanceOf(DeviceRiskFraudAssessor.class));
  }

  @Test
  void invalidAttemptLimit_failsStartup() {
    runner.withPropertyValues("vigil.max-pin-attempts=0")
        .run(context -> {
          assertThat(context).hasFailed();
          assertThat(context.getStartupFailure())
              .hasRootCauseInstanceOf(IllegalArgumentException.class)
              .hasStackTraceContaining("maxPinAttempts must be positive");
        });
  }

  @Test
  void invertedRiskThresholds_failStartup() {
    runner.withPropertyValues("vigil.risk.medium-threshold=0.9")
        .run(context -> {
          assertThat(context).hasFailed();
          assertThat(context.getStartupFailure())
              .hasStackTraceContaining("Invalid vigil.risk.* configuration");
        });
  }

  @Test
  void wiredEngine_enrollsAndAuthenticatesPin() {
    runner.withPropertyValues("vigil.fallback-chain=pin")
        .run(context -> {
          AuthOrchestrator orchestrator = context.getBean(AuthOrchestrator.class);
          AuthIdentity alice = AuthIdentity.of("alice");

          assertThat(orchestrator.enrollPin(alice, "4821", "4821").success()).isTrue();
          AuthAttemptResult result = orchestrator.authenticate(
              AuthRequest.of(alice, AuthMethod.PIN, "4821"));

          assertThat(result.state()).isEqualTo(AuthState.AUTHENTICATED);
          assertThat(orchestrator.validateSession(result.sessionToken()))
              .hasValueSatisfying(session -> assertThat(session.identity()).isEqualTo(alice));
        });
  }
}
