package com.codeheadsystems.vigil.server.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Engine configuration.
 *
 * @param platformTimeout       how long to wait for a platform assertion or enrollment
 * @param maxPinAttempts        consecutive wrong PINs before the PIN locks
 * @param pinLockoutDuration    how long a locked PIN stays locked
 * @param sessionTtl            session lifetime
 * @param otpExpiry             one-time code lifetime
 * @param maxOtpAttempts        verification attempts allowed per one-time code
 * @param otpLength             number of digits in a one-time code
 * @param rateLimitWindow       length of the per-identity attempt window
 * @param maxRateLimitAttempts  attempts allowed per window
 * @param pushChallengeTtl      lifetime of a push approval request
 * @param fallbackChain         method order
 * @param blockOnHighDeviceRisk block attempts whose device risk is rated high
 */
public record AuthConfig(Duration platformTimeout,
                         int maxPinAttempts,
                         Duration pinLockoutDuration,
                         Duration sessionTtl,
                         Duration otpExpiry,
                         int maxOtpAttempts,
                         int otpLength,
                         Duration rateLimitWindow,
                         int maxRateLimitAttempts,
                         Duration pushChallengeTtl,
                         FallbackChain fallbackChain,
                         boolean blockOnHighDeviceRisk) {

  /**
   * The default configuration.
   */
  public static final AuthConfig DEFAULT = new AuthConfig(
      Duration.ofSeconds(60),
      5,
      Duration.ofMinutes(15),
      Duration.ofMinutes(30),
      Duration.ofMinutes(5),
      3,
      6,
      Duration.ofMinutes(15),
      10,
      Duration.ofMinutes(5),
      FallbackChain.DEFAULT,
      false);

  public AuthConfig {
    requirePositive(platformTimeout, "platformTimeout");
    requirePositive(pinLockoutDuration, "pinLockoutDuration");
    requirePositive(sessionTtl, "sessionTtl");
    requirePositive(otpExpiry, "otpExpiry");
    requirePositive(rateLimitWindow, "rateLimitWindow");
    requirePositive(pushChallengeTtl, "pushChallengeTtl");
    requirePositive(maxPinAttempts, "maxPinAttempts");
    requirePositive(maxOtpAttempts, "maxOtpAttempts");
    requirePositive(maxRateLimitAttempts, "maxRateLimitAttempts");
    if (otpLength < 4 || otpLength > 10) {
      throw new IllegalArgumentException("otpLength must be between 4 and 10: " + otpLength);
    }
    Objects.requireNonNull(fallbackChain, "fallbackChain");
  }

  private static void requirePositive(Duration value, String name) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be a positive duration: " + value);
    }
  }

  private static void requirePositive(int value, String name) {
    if (value < 1) {
      throw new IllegalArgumentException(name + " must be positive: " + value);
    }
  }

  public AuthConfig withPlatformTimeout(Duration value) {
    return new AuthConfig(value, maxPinAttempts, pinLockoutDuration, sessionTtl, otpExpiry,
        maxOtpAttempts, otpLength, rateLimitWindow, maxRateLimitAttempts, pushChallengeTtl,
        fallbackChain, blockOnHighDeviceRisk);
  }

  public AuthConfig withPinLockout(int maxAttempts, Duration duration) {
    return new AuthConfig(platformTimeout, maxAttempts, duration, sessionTtl, otpExpiry,
        maxOtpAttempts, otpLength, rateLimitWindow, maxRateLimitAttempts, pushChallengeTtl,
        fallbackChain, blockOnHighDeviceRisk);
  }

  public AuthConfig withSessionTtl(Duration value) {
    return new AuthConfig(platformTimeout, maxPinAttempts, pinLockoutDuration, value, otpExpiry,
        maxOtpAttempts, otpLength, rateLimitWindow, maxRateLimitAttempts, pushChallengeTtl,
        fallbackChain, blockOnHighDeviceRisk);
  }

  public AuthConfig withOtp(Duration expiry, int maxAttempts) {
    return new AuthConfig(platformTimeout, maxPinAttempts, pinLockoutDuration, sessionTtl, expiry,
        maxAttempts, otpLength, rateLimitWindow, maxRateLimitAttempts, pushChallengeTtl,
        fallbackChain, blockOnHighDeviceRisk);
  }

  public AuthConfig withRateLimit(Duration window, int maxAttempts) {
    return new AuthConfig(platformTimeout, maxPinAttempts, pinLockoutDuration, sessionTtl,
        otpExpiry, maxOtpAttempts, otpLength, window, maxAttempts, pushChallengeTtl,
        fallbackChain, blockOnHighDeviceRisk);
  }

  public AuthConfig withPushChallengeTtl(Duration value) {
    return new AuthConfig(platformTimeout, maxPinAttempts, pinLockoutDuration, sessionTtl,
        otpExpiry, maxOtpAttempts, otpLength, rateLimitWindow, maxRateLimitAttempts, value,
        fallbackChain, blockOnHighDeviceRisk);
  }

  public AuthConfig withFallbackChain(FallbackChain value) {
    return new AuthConfig(platformTimeout, maxPinAttempts, pinLockoutDuration, sessionTtl,
        otpExpiry, maxOtpAttempts, otpLength, rateLimitWindow, maxRateLimitAttempts,
        pushChallengeTtl, value, blockOnHighDeviceRisk);
  }

  public AuthConfig withBlockOnHighDeviceRisk(boolean value) {
    return new AuthConfig(platformTimeout, maxPinAttempts, pinLockoutDuration, sessionTtl,
        otpExpiry, maxOtpAttempts, otpLength, rateLimitWindow, maxRateLimitAttempts,
        pushChallengeTtl, fallbackChain, value);
  }
}
