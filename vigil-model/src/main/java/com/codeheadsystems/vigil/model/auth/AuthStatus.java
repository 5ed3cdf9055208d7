package com.codeheadsystems.vigil.model.auth;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;

/**
 * Snapshot of what an identity can currently authenticate with.
 *
 * @param hasPlatformCredential whether a platform credential is enrolled
 * @param hasPin                whether a PIN is enrolled
 * @param pinLocked             whether the PIN is currently locked out
 * @param pinLockoutRemaining   remaining PIN lockout, null if not locked
 * @param rateLimited           whether the global attempt window is exhausted
 * @param rateLimitRemaining    time until the window resets, null if not limited
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthStatus(
    @JsonProperty("hasPlatformCredential") boolean hasPlatformCredential,
    @JsonProperty("hasPin") boolean hasPin,
    @JsonProperty("pinLocked") boolean pinLocked,
    @JsonProperty("pinLockoutRemaining") Duration pinLockoutRemaining,
    @JsonProperty("rateLimited") boolean rateLimited,
    @JsonProperty("rateLimitRemaining") Duration rateLimitRemaining) {
}
