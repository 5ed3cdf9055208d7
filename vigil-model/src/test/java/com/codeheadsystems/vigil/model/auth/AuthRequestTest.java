package com.codeheadsystems.vigil.model.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * The type Auth request test.
 */
class AuthRequestTest {

  private static final AuthIdentity ALICE = AuthIdentity.of("alice");

  @Test
  void timeoutOr_noTimeout_usesFallback() {
    AuthRequest request = AuthRequest.of(ALICE, AuthMethod.PUSH, null);

    assertThat(request.timeout()).isNull();
    assertThat(request.timeoutOr(Duration.ofMinutes(5))).isEqualTo(Duration.ofMinutes(5));
  }

  @Test
  void withTimeout_overridesFallbackAndSurvivesCopies() {
    AuthRequest request = AuthRequest.of(ALICE, AuthMethod.PUSH, null)
        .withTimeout(Duration.ofSeconds(20))
        .withMethod(AuthMethod.PLATFORM);

    assertThat(request.method()).isEqualTo(AuthMethod.PLATFORM);
    assertThat(request.timeoutOr(Duration.ofMinutes(5))).isEqualTo(Duration.ofSeconds(20));
  }

  /**
   * Zero and negative timeouts are rejected.
   */
  @Test
  void withTimeout_notPositive_throws() {
    AuthRequest request = AuthRequest.of(ALICE, AuthMethod.PLATFORM, null);

    assertThatThrownBy(() -> request.withTimeout(Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("timeout must be positive");
    assertThatThrownBy(() -> request.withTimeout(Duration.ofSeconds(-1)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
