package com.codeheadsystems.vigil.server.manager;

import java.time.Instant;

/**
 * Read-only view of an identity's rate-limit window.
 *
 * @param attemptCount      attempts in the current window
 * @param remainingAttempts attempts left before the limit is hit
 * @param resetAt           when the current window closes, null if no window is open
 * @param limited           whether the next attempt would be denied
 */
public record RateLimitStatus(int attemptCount, int remainingAttempts, Instant resetAt,
                              boolean limited) {
}
