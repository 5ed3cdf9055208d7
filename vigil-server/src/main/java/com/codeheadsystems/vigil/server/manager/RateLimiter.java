package com.codeheadsystems.vigil.server.manager;

import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import com.codeheadsystems.vigil.server.config.AuthConfig;
import com.codeheadsystems.vigil.server.store.KeyValueStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed window per identity, reset lazily on the first attempt at or after {@code resetAt}.
 * <p>
 * Every attempt is counted, including denied ones, so the counter reflects arrival order.
 * Check and increment happen in one compare-and-set on the identity's bucket; identities never
 * contend with each other.
 */
@Singleton
public class RateLimiter {

  private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

  private final KeyValueStore<AuthIdentity, RateLimitBucket> buckets;
  private final Duration window;
  private final int maxAttempts;
  private final Clock clock;

  @Inject
  public RateLimiter(final KeyValueStore<AuthIdentity, RateLimitBucket> buckets,
                     final AuthConfig config,
                     final Clock clock) {
    log.info("RateLimiter(window={}, maxAttempts={})", config.rateLimitWindow(),
        config.maxRateLimitAttempts());
    this.buckets = Objects.requireNonNull(buckets, "buckets");
    this.window = config.rateLimitWindow();
    this.maxAttempts = config.maxRateLimitAttempts();
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Counts an attempt and decides whether it may proceed.
   *
   * @param identity the identity
   * @return the decision
   */
  public RateLimitDecision checkAndConsume(AuthIdentity identity) {
    Objects.requireNonNull(identity, "identity");
    while (true) {
      Instant now = clock.instant();
      Optional<RateLimitBucket> current = buckets.get(identity);
      if (current.isEmpty()) {
        RateLimitBucket fresh = RateLimitBucket.open(identity, now, window);
        if (buckets.putIfAbsent(identity, fresh).isEmpty()) {
          return new RateLimitDecision(true, 1, null);
        }
        continue;
      }
      RateLimitBucket bucket = current.get();
      if (bucket.isElapsedAt(now)) {
        RateLimitBucket fresh = RateLimitBucket.open(identity, now, window);
        if (buckets.compareAndSet(identity, bucket, fresh)) {
          return new RateLimitDecision(true, 1, null);
        }
        continue;
      }
      RateLimitBucket incremented = bucket.increment();
      if (!buckets.compareAndSet(identity, bucket, incremented)) {
        continue;
      }
      if (incremented.attemptCount() > maxAttempts) {
        Duration remaining = Duration.between(now, incremented.resetAt());
        log.debug("Rate limit exceeded for identity={} ({} attempts, reset in {})",
            identity, incremented.attemptCount(), remaining);
        return new RateLimitDecision(false, incremented.attemptCount(), remaining);
      }
      return new RateLimitDecision(true, incremented.attemptCount(), null);
    }
  }

  /**
   * Current window state without counting an attempt.
   *
   * @param identity the identity
   * @return the status
   */
  public RateLimitStatus status(AuthIdentity identity) {
    Instant now = clock.instant();
    return buckets.get(identity)
        .filter(bucket -> !bucket.isElapsedAt(now))
        .map(bucket -> new RateLimitStatus(bucket.attemptCount(),
            Math.max(0, maxAttempts - bucket.attemptCount()), bucket.resetAt(),
            bucket.attemptCount() >= maxAttempts))
        .orElseGet(() -> new RateLimitStatus(0, maxAttempts, null, false));
  }

  /**
   * Clears the identity's window.
   *
   * @param identity the identity
   */
  public void reset(AuthIdentity identity) {
    log.debug("reset(identity={})", identity);
    buckets.delete(identity);
  }
}
