package com.codeheadsystems.vigil.server.manager;

import java.time.Duration;
import java.util.Optional;

/**
 * Result of {@link RateLimiter#checkAndConsume}.
 *
 * @param allowed          whether the attempt may proceed
 * @param attemptCount     attempts in the current window including this one
 * @param remainingLockout time until the window resets, null when allowed
 */
public record RateLimitDecision(boolean allowed, int attemptCount, Duration remainingLockout) {

  public Optional<Duration> lockoutRemaining() {
    return Optional.ofNullable(remainingLockout);
  }
}
