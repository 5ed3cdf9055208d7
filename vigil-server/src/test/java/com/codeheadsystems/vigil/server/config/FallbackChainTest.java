package com.codeheadsystems.vigil.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.vigil.model.auth.AuthMethod;
import java.util.List;
import org.junit.jupiter.api.Test;

class FallbackChainTest {

  @Test
  void defaultChain_ordersPlatformPinSmsPush() {
    assertThat(FallbackChain.DEFAULT.methods())
        .containsExactly(AuthMethod.PLATFORM, AuthMethod.PIN, AuthMethod.SMS, AuthMethod.PUSH);
    assertThat(FallbackChain.DEFAULT.first()).isEqualTo(AuthMethod.PLATFORM);
  }

  @Test
  void next_walksTheChainAndStopsAtTheEnd() {
    assertThat(FallbackChain.DEFAULT.next(AuthMethod.PLATFORM)).contains(AuthMethod.PIN);
    assertThat(FallbackChain.DEFAULT.next(AuthMethod.PIN)).contains(AuthMethod.SMS);
    assertThat(FallbackChain.DEFAULT.next(AuthMethod.SMS)).contains(AuthMethod.PUSH);
    assertThat(FallbackChain.DEFAULT.next(AuthMethod.PUSH)).isEmpty();
  }

  @Test
  void next_methodNotInChain_empty() {
    FallbackChain chain = FallbackChain.of(AuthMethod.PIN, AuthMethod.SMS);

    assertThat(chain.contains(AuthMethod.PLATFORM)).isFalse();
    assertThat(chain.next(AuthMethod.PLATFORM)).isEmpty();
  }

  @Test
  void constructor_rejectsEmptyOrDuplicates() {
    assertThatThrownBy(() -> new FallbackChain(List.of())).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> FallbackChain.of(AuthMethod.PIN, AuthMethod.PIN))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
