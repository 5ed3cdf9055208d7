package com.codeheadsystems.vigil.server.manager;

import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import java.time.Duration;
import java.time.Instant;

/**
 * Attempt counter for one identity and one window. Replaced, never mutated.
 *
 * @param identity     the identity
 * @param windowStart  when the window opened
 * @param attemptCount attempts seen in this window, denied ones included
 * @param resetAt      when the window closes
 */
public record RateLimitBucket(AuthIdentity identity,
                              Instant windowStart,
                              int attemptCount,
                              Instant resetAt) {

  static RateLimitBucket open(AuthIdentity identity, Instant now, Duration window) {
    return new RateLimitBucket(identity, now, 1, now.plus(window));
  }

  RateLimitBucket increment() {
    int next = attemptCount == Integer.MAX_VALUE ? attemptCount : attemptCount + 1;
    return new RateLimitBucket(identity, windowStart, next, resetAt);
  }

  boolean isElapsedAt(Instant now) {
    return !now.isBefore(resetAt);
  }
}
