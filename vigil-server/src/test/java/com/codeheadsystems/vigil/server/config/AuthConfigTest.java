package com.codeheadsystems.vigil.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class AuthConfigTest {

  @Test
  void defaults() {
    AuthConfig config = AuthConfig.DEFAULT;

    assertThat(config.platformTimeout()).isEqualTo(Duration.ofSeconds(60));
    assertThat(config.maxPinAttempts()).isEqualTo(5);
    assertThat(config.pinLockoutDuration()).isEqualTo(Duration.ofMinutes(15));
    assertThat(config.sessionTtl()).isEqualTo(Duration.ofMinutes(30));
    assertThat(config.otpExpiry()).isEqualTo(Duration.ofMinutes(5));
    assertThat(config.maxOtpAttempts()).isEqualTo(3);
    assertThat(config.otpLength()).isEqualTo(6);
    assertThat(config.rateLimitWindow()).isEqualTo(Duration.ofMinutes(15));
    assertThat(config.maxRateLimitAttempts()).isEqualTo(10);
    assertThat(config.fallbackChain()).isEqualTo(FallbackChain.DEFAULT);
    assertThat(config.blockOnHighDeviceRisk()).isFalse();
  }

  @Test
  void withMethods_changeOnlyTheirField() {
    AuthConfig changed = AuthConfig.DEFAULT.withSessionTtl(Duration.ofMinutes(5));

    assertThat(changed.sessionTtl()).isEqualTo(Duration.ofMinutes(5));
    assertThat(changed.withSessionTtl(AuthConfig.DEFAULT.sessionTtl())).isEqualTo(AuthConfig.DEFAULT);
  }

  @Test
  void constructor_rejectsNonPositiveValues() {
    assertThatThrownBy(() -> AuthConfig.DEFAULT.withSessionTtl(Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> AuthConfig.DEFAULT.withPinLockout(0, Duration.ofMinutes(1)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> AuthConfig.DEFAULT.withRateLimit(Duration.ofSeconds(-1), 3))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> AuthConfig.DEFAULT.withFallbackChain(null))
        .isInstanceOf(NullPointerException.class);
  }
}
