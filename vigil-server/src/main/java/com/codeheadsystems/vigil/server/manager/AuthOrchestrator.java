package com.codeheadsystems.vigil.server.manager;

import com.codeheadsystems.vigil.device.fingerprint.DeviceFingerprintGenerator;
import com.codeheadsystems.vigil.device.risk.RiskScorer;
import com.codeheadsystems.vigil.model.auth.AuthAttemptResult;
import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import com.codeheadsystems.vigil.model.auth.AuthMethod;
import com.codeheadsystems.vigil.model.auth.AuthRequest;
import com.codeheadsystems.vigil.model.auth.AuthSession;
import com.codeheadsystems.vigil.model.auth.AuthState;
import com.codeheadsystems.vigil.model.auth.AuthStatus;
import com.codeheadsystems.vigil.model.auth.EnrollmentResult;
import com.codeheadsystems.vigil.model.auth.ErrorKind;
import com.codeheadsystems.vigil.model.auth.NextAction;
import com.codeheadsystems.vigil.model.device.DeviceFingerprint;
import com.codeheadsystems.vigil.model.device.DeviceRiskAssessment;
import com.codeheadsystems.vigil.model.device.RiskLevel;
import com.codeheadsystems.vigil.model.event.SecurityEventKind;
import com.codeheadsystems.vigil.model.event.SecurityEventRecord;
import com.codeheadsystems.vigil.server.config.AuthConfig;
import com.codeheadsystems.vigil.server.config.FallbackChain;
import com.codeheadsystems.vigil.server.event.SecurityEventSink;
import com.codeheadsystems.vigil.server.fraud.AuthContext;
import com.codeheadsystems.vigil.server.fraud.FraudAssessment;
import com.codeheadsystems.vigil.server.fraud.FraudSignalAssessor;
import com.codeheadsystems.vigil.server.verifier.CredentialVerifier;
import com.codeheadsystems.vigil.server.verifier.PinVerifier;
import com.codeheadsystems.vigil.server.verifier.PlatformVerifier;
import com.codeheadsystems.vigil.server.verifier.PushResolution;
import com.codeheadsystems.vigil.server.verifier.PushVerifier;
import com.codeheadsystems.vigil.server.verifier.SmsVerifier;
import com.codeheadsystems.vigil.server.verifier.VerificationOutcome;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic entry point of the engine: runs one authentication attempt through rate
 * limiting, device risk and fraud checks, the method's verifier and session issuance, and
 * tells the caller what to do next.
 * <p>
 * Every outcome is returned as an {@link AuthAttemptResult}; nothing on the authentication path
 * throws for expected failures. Failures of the audit sink, the fraud collaborator and the
 * durable session store are logged and do not change the outcome.
 * <p>
 * The global rate limit and the PIN / one-time code lockouts are independent counters and
 * either one can stop an attempt.
 */
@Singleton
public class AuthOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(AuthOrchestrator.class);

  private final AuthConfig config;
  private final FallbackChain chain;
  private final RateLimiter rateLimiter;
  private final SessionManager sessionManager;
  private final Map<AuthMethod, CredentialVerifier> verifiers;
  private final DeviceFingerprintGenerator fingerprintGenerator;
  private final RiskScorer riskScorer;
  private final SecurityEventSink eventSink;
  private final FraudSignalAssessor fraudAssessor;
  private final Clock clock;

  /**
   * Instantiates a new Auth orchestrator.
   *
   * @param config               the config
   * @param rateLimiter          the rate limiter
   * @param sessionManager       the session manager
   * @param verifiers            one verifier per supported method
   * @param fingerprintGenerator the fingerprint generator
   * @param riskScorer           the risk scorer
   * @param eventSink            the audit sink
   * @param fraudAssessor        optional fraud collaborator, may be null
   * @param clock                the clock
   */
  @Inject
  public AuthOrchestrator(final AuthConfig config,
                          final RateLimiter rateLimiter,
                          final SessionManager sessionManager,
                          final List<CredentialVerifier> verifiers,
                          final DeviceFingerprintGenerator fingerprintGenerator,
                          final RiskScorer riskScorer,
                          final SecurityEventSink eventSink,
                          final FraudSignalAssessor fraudAssessor,
                          final Clock clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.chain = config.fallbackChain();
    this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
    this.sessionManager = Objects.requireNonNull(sessionManager, "sessionManager");
    this.fingerprintGenerator = Objects.requireNonNull(fingerprintGenerator, "fingerprintGenerator");
    this.riskScorer = Objects.requireNonNull(riskScorer, "riskScorer");
    this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
    this.fraudAssessor = fraudAssessor;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.verifiers = new EnumMap<>(AuthMethod.class);
    for (CredentialVerifier verifier : verifiers) {
      if (this.verifiers.put(verifier.method(), verifier) != null) {
        throw new IllegalArgumentException("Duplicate verifier for " + verifier.method());
      }
    }
    log.info("AuthOrchestrator(chain={}, verifiers={}, fraudAssessor={})", chain.methods(),
        this.verifiers.keySet(), fraudAssessor != null);
  }

  // ── Authentication ────────────────────────────────────────────────────────

  /**
   * Runs one authentication attempt.
   *
   * @param request the request; a null method starts at the head of the fallback chain
   * @return the result
   */
  public AuthAttemptResult authenticate(AuthRequest request) {
    Objects.requireNonNull(request, "request");
    Instant start = clock.instant();
    AuthIdentity identity = request.identity();
    AuthMethod method = request.method() != null ? request.method() : chain.first();
    log.debug("authenticate(identity={}, method={})", identity, method.wireName());

    RateLimitDecision decision = rateLimiter.checkAndConsume(identity);
    if (!decision.allowed()) {
      record(SecurityEventKind.RATE_LIMITED, identity, method, null,
          Map.of("attempts", String.valueOf(decision.attemptCount())));
      return AuthAttemptResult.failure(method, AuthState.RATE_LIMITED,
          ErrorKind.RATE_LIMIT_EXCEEDED, NextAction.WAIT, null, decision.remainingLockout(),
          elapsed(start));
    }

    AttemptRisk risk = assessRisk(identity, method, request);
    if (risk.blocked()) {
      Map<String, String> metadata = Map.of("anomalies", String.join("; ", risk.anomalies()));
      record(SecurityEventKind.FRAUD_DETECTED, identity, method, risk, metadata);
      record(SecurityEventKind.ACCOUNT_LOCKED, identity, method, risk, metadata);
      return AuthAttemptResult.failure(method, AuthState.BLOCKED, ErrorKind.BLOCKED,
          NextAction.CONTACT_SUPPORT, null, null, elapsed(start));
    }

    CredentialVerifier verifier = verifiers.get(method);
    VerificationOutcome outcome;
    if (verifier == null) {
      log.debug("No verifier configured for {}", method.wireName());
      outcome = VerificationOutcome.rejected(ErrorKind.TRANSPORT_UNAVAILABLE);
    } else {
      outcome = invoke(method, () -> verifier.verify(identity, request));
    }
    return complete(identity, method, outcome, risk, start);
  }

  /**
   * Sends an SMS one-time code. Counts against the identity's rate limit.
   *
   * @param identity    the identity
   * @param phoneNumber destination
   * @return awaiting verification on delivery, otherwise a failure pointing at the next method
   */
  public AuthAttemptResult sendSmsCode(AuthIdentity identity, String phoneNumber) {
    Instant start = clock.instant();
    log.debug("sendSmsCode(identity={})", identity);
    RateLimitDecision decision = rateLimiter.checkAndConsume(identity);
    if (!decision.allowed()) {
      record(SecurityEventKind.RATE_LIMITED, identity, AuthMethod.SMS, null, Map.of());
      return AuthAttemptResult.failure(AuthMethod.SMS, AuthState.RATE_LIMITED,
          ErrorKind.RATE_LIMIT_EXCEEDED, NextAction.WAIT, null, decision.remainingLockout(),
          elapsed(start));
    }
    Optional<SmsVerifier> sms = verifier(AuthMethod.SMS, SmsVerifier.class);
    VerificationOutcome outcome = sms
        .map(v -> invoke(AuthMethod.SMS, () -> v.sendCode(identity, phoneNumber)))
        .orElseGet(() -> VerificationOutcome.rejected(ErrorKind.TRANSPORT_UNAVAILABLE));
    return complete(identity, AuthMethod.SMS, outcome, AttemptRisk.NONE, start);
  }

  /**
   * Applies a device's answer to a push challenge. On approval a session is issued for the
   * identity the challenge was sent to.
   *
   * @param challengeToken the challenge token
   * @param approved       whether the user approved
   * @return the result
   */
  public AuthAttemptResult resolvePushResponse(String challengeToken, boolean approved) {
    Instant start = clock.instant();
    Optional<PushVerifier> push = verifier(AuthMethod.PUSH, PushVerifier.class);
    if (push.isEmpty()) {
      return AuthAttemptResult.failure(AuthMethod.PUSH, AuthState.FAILED,
          ErrorKind.TRANSPORT_UNAVAILABLE, NextAction.CONTACT_SUPPORT, null, null, elapsed(start));
    }
    PushResolution resolution = push.get().resolve(challengeToken, approved);
    if (resolution.challenge() == null) {
      return AuthAttemptResult.failure(AuthMethod.PUSH, AuthState.FAILED,
          resolution.outcome().errorKind(), NextAction.REQUEST_NEW_CHALLENGE, null, null,
          elapsed(start));
    }
    AuthIdentity identity = resolution.challenge().identity();
    if (resolution.outcome().errorKind() != ErrorKind.CHALLENGE_ALREADY_RESOLVED) {
      record(SecurityEventKind.PUSH_RESOLVED, identity, AuthMethod.PUSH, AttemptRisk.NONE,
          Map.of("status", resolution.challenge().status().name()));
    }
    return complete(identity, AuthMethod.PUSH, resolution.outcome(), AttemptRisk.NONE, start);
  }

  // ── Enrollment ────────────────────────────────────────────────────────────

  /**
   * Enroll pin enrollment result.
   *
   * @param identity     the identity
   * @param pin          the pin
   * @param confirmation the confirmation
   * @return the enrollment result
   */
  public EnrollmentResult enrollPin(AuthIdentity identity, String pin, String confirmation) {
    Optional<PinVerifier> pinVerifier = verifier(AuthMethod.PIN, PinVerifier.class);
    if (pinVerifier.isEmpty()) {
      return EnrollmentResult.rejected(AuthMethod.PIN, ErrorKind.TRANSPORT_UNAVAILABLE,
          "PIN authentication is not configured");
    }
    EnrollmentResult result = pinVerifier.get().enroll(identity, pin, confirmation);
    if (result.success()) {
      record(SecurityEventKind.PIN_ENROLLED, identity, AuthMethod.PIN, AttemptRisk.NONE, Map.of());
    }
    return result;
  }

  /**
   * Enroll platform enrollment result.
   *
   * @param identity    the identity
   * @param displayName the display name
   * @return the enrollment result
   */
  public EnrollmentResult enrollPlatform(AuthIdentity identity, String displayName) {
    Optional<PlatformVerifier> platform = verifier(AuthMethod.PLATFORM, PlatformVerifier.class);
    if (platform.isEmpty()) {
      return EnrollmentResult.rejected(AuthMethod.PLATFORM, ErrorKind.TRANSPORT_UNAVAILABLE,
          "Platform authentication is not configured");
    }
    EnrollmentResult result = invokeEnrollment(() -> platform.get().enroll(identity, displayName));
    if (result.success()) {
      record(SecurityEventKind.BIOMETRIC_ENROLLED, identity, AuthMethod.PLATFORM, AttemptRisk.NONE,
          Map.of());
    }
    return result;
  }

  // ── Status and sessions ───────────────────────────────────────────────────

  /**
   * What the identity can currently authenticate with.
   *
   * @param identity the identity
   * @return the status
   */
  public AuthStatus getAuthStatus(AuthIdentity identity) {
    boolean hasPlatform = Optional.ofNullable(verifiers.get(AuthMethod.PLATFORM))
        .map(v -> v.isEnrolled(identity)).orElse(false);
    Optional<PinVerifier> pin = verifier(AuthMethod.PIN, PinVerifier.class);
    boolean hasPin = pin.map(v -> v.isEnrolled(identity)).orElse(false);
    Duration pinLockout = pin.flatMap(v -> v.lockoutRemaining(identity)).orElse(null);
    RateLimitStatus rate = rateLimiter.status(identity);
    Duration rateRemaining = rate.limited()
        ? Duration.between(clock.instant(), rate.resetAt())
        : null;
    return new AuthStatus(hasPlatform, hasPin, pinLockout != null, pinLockout, rate.limited(),
        rateRemaining);
  }

  /**
   * Validates a session token; records {@code session_expired} when it has just expired.
   *
   * @param token the token
   * @return the session if valid
   */
  public Optional<AuthSession> validateSession(String token) {
    SessionValidation validation = sessionManager.validateSession(token);
    if (validation.status() == SessionValidation.Status.EXPIRED) {
      AuthSession expired = validation.session();
      record(SecurityEventKind.SESSION_EXPIRED, expired.identity(), expired.method(),
          AttemptRisk.NONE, Map.of());
    }
    return validation.asOptional();
  }

  /**
   * Revokes a session and records {@code session_revoked}.
   *
   * @param token the token
   * @return true if a session was revoked
   */
  public boolean logout(String token) {
    Optional<AuthSession> revoked = sessionManager.revoke(token);
    revoked.ifPresent(s -> record(SecurityEventKind.SESSION_REVOKED, s.identity(), s.method(),
        AttemptRisk.NONE, Map.of()));
    return revoked.isPresent();
  }

  // ── Internals ─────────────────────────────────────────────────────────────

  private AuthAttemptResult complete(AuthIdentity identity, AuthMethod method,
                                     VerificationOutcome outcome, AttemptRisk risk,
                                     Instant start) {
    switch (outcome.status()) {
      case VERIFIED -> {
        AuthSession session = sessionManager.createSession(identity, method);
        if (method == AuthMethod.SMS) {
          record(SecurityEventKind.OTP_VERIFIED, identity, method, risk, Map.of());
        }
        record(SecurityEventKind.AUTH_SUCCESS, identity, method, risk, Map.of());
        return AuthAttemptResult.authenticated(method, session.token(), elapsed(start));
      }
      case PENDING -> {
        record(method == AuthMethod.PUSH ? SecurityEventKind.PUSH_SENT : SecurityEventKind.OTP_SENT,
            identity, method, risk, Map.of());
        return AuthAttemptResult.awaitingVerification(method, outcome.challengeToken(),
            elapsed(start));
      }
      default -> {
        return failure(identity, method, outcome, risk, start);
      }
    }
  }

  private AuthAttemptResult failure(AuthIdentity identity, AuthMethod method,
                                    VerificationOutcome outcome, AttemptRisk risk, Instant start) {
    ErrorKind kind = outcome.errorKind();
    Map<String, String> metadata = new HashMap<>();
    metadata.put("errorKind", kind.name());
    if (outcome.attemptsRemaining() != null) {
      metadata.put("attemptsRemaining", String.valueOf(outcome.attemptsRemaining()));
    }
    record(SecurityEventKind.AUTH_FAILURE, identity, method, risk, metadata);
    Optional<AuthMethod> next = chain.next(method);

    if (kind == ErrorKind.CREDENTIAL_LOCKED_OUT) {
      record(method == AuthMethod.PIN ? SecurityEventKind.PIN_LOCKOUT : SecurityEventKind.OTP_LOCKOUT,
          identity, method, risk, Map.of("lockoutRemaining", String.valueOf(outcome.lockoutRemaining())));
      return AuthAttemptResult.failure(method, AuthState.LOCKED_OUT, kind,
          next.isPresent() ? NextAction.SWITCH_METHOD : NextAction.WAIT, next.orElse(null),
          outcome.lockoutRemaining(), elapsed(start));
    }
    if (kind == ErrorKind.INVALID_CREDENTIAL_FORMAT) {
      return AuthAttemptResult.failure(method, AuthState.AWAITING_NEXT_METHOD, kind,
          NextAction.CORRECT_INPUT, method, null, elapsed(start));
    }
    if (kind == ErrorKind.CHALLENGE_ALREADY_RESOLVED) {
      return AuthAttemptResult.failure(method, AuthState.AWAITING_NEXT_METHOD, kind,
          NextAction.REQUEST_NEW_CHALLENGE, method, null, elapsed(start));
    }
    if (kind.triggersFallback() && next.isPresent()) {
      return AuthAttemptResult.failure(method, AuthState.AWAITING_NEXT_METHOD, kind,
          NextAction.SWITCH_METHOD, next.get(), null, elapsed(start));
    }
    return AuthAttemptResult.failure(method, AuthState.FAILED, kind, NextAction.CONTACT_SUPPORT,
        null, null, elapsed(start));
  }

  private AttemptRisk assessRisk(AuthIdentity identity, AuthMethod method, AuthRequest request) {
    DeviceFingerprint fingerprint = null;
    DeviceRiskAssessment deviceRisk = null;
    List<String> anomalies = new ArrayList<>();
    boolean block = false;
    if (request.deviceSignals() != null) {
      fingerprint = fingerprintGenerator.fingerprint(request.deviceSignals());
      deviceRisk = riskScorer.assess(fingerprint);
      if (config.blockOnHighDeviceRisk() && deviceRisk.level() == RiskLevel.HIGH) {
        block = true;
        anomalies.addAll(deviceRisk.reasons());
      }
    }
    if (fraudAssessor != null) {
      try {
        FraudAssessment assessment = fraudAssessor.assess(identity, fingerprint,
            new AuthContext(method, request.attributes(), deviceRisk));
        if (assessment.shouldBlock()) {
          block = true;
          anomalies.addAll(assessment.anomalies());
        } else if (assessment.requiresReview()) {
          log.info("Attempt by identity={} flagged for review: {}", identity, assessment.anomalies());
        }
      } catch (RuntimeException e) {
        log.warn("Fraud signal assessment failed for identity={}; proceeding without block check",
            identity, e);
      }
    }
    return new AttemptRisk(fingerprint, deviceRisk, block, List.copyOf(anomalies));
  }

  private VerificationOutcome invoke(AuthMethod method, Supplier<VerificationOutcome> call) {
    try {
      VerificationOutcome outcome = call.get();
      return outcome != null ? outcome : VerificationOutcome.rejected(ErrorKind.PROVIDER_FAILURE);
    } catch (RuntimeException e) {
      log.warn("Verifier for {} failed", method.wireName(), e);
      return VerificationOutcome.rejected(ErrorKind.PROVIDER_FAILURE);
    }
  }

  private EnrollmentResult invokeEnrollment(Supplier<EnrollmentResult> call) {
    try {
      return call.get();
    } catch (RuntimeException e) {
      log.warn("Platform enrollment failed", e);
      return EnrollmentResult.rejected(AuthMethod.PLATFORM, ErrorKind.PROVIDER_FAILURE,
          "Platform authenticator failed");
    }
  }

  private <T extends CredentialVerifier> Optional<T> verifier(AuthMethod method, Class<T> type) {
    CredentialVerifier verifier = verifiers.get(method);
    return type.isInstance(verifier) ? Optional.of(type.cast(verifier)) : Optional.empty();
  }

  private void record(SecurityEventKind kind, AuthIdentity identity, AuthMethod method,
                      AttemptRisk risk, Map<String, String> metadata) {
    Double score = risk != null && risk.deviceRisk() != null ? risk.deviceRisk().score() : null;
    String fingerprintId = risk != null && risk.fingerprint() != null ? risk.fingerprint().id() : null;
    try {
      eventSink.record(new SecurityEventRecord(identity, kind, method, clock.instant(), score,
          fingerprintId, metadata));
    } catch (RuntimeException e) {
      log.warn("Failed to record security event {} for identity={}", kind.wireName(), identity, e);
    }
  }

  private Duration elapsed(Instant start) {
    Duration elapsed = Duration.between(start, clock.instant());
    return elapsed.isNegative() ? Duration.ZERO : elapsed;
  }

  private record AttemptRisk(DeviceFingerprint fingerprint, DeviceRiskAssessment deviceRisk,
                             boolean blocked, List<String> anomalies) {
    static final AttemptRisk NONE = new AttemptRisk(null, null, false, List.of());
  }
}
