package com.codeheadsystems.vigil.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.vigil.device.fingerprint.DeviceFingerprintGenerator;
import com.codeheadsystems.vigil.device.fingerprint.FingerprintConfig;
import com.codeheadsystems.vigil.device.risk.RiskScorer;
import com.codeheadsystems.vigil.device.risk.RiskThresholds;
import com.codeheadsystems.vigil.model.auth.AuthAttemptResult;
import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import com.codeheadsystems.vigil.model.auth.AuthMethod;
import com.codeheadsystems.vigil.model.auth.AuthRequest;
import com.codeheadsystems.vigil.model.auth.AuthSession;
import com.codeheadsystems.vigil.model.auth.AuthState;
import com.codeheadsystems.vigil.model.auth.AuthStatus;
import com.codeheadsystems.vigil.model.auth.ErrorKind;
import com.codeheadsystems.vigil.model.auth.NextAction;
import com.codeheadsystems.vigil.model.event.SecurityEventKind;
import com.codeheadsystems.vigil.model.event.SecurityEventRecord;
import com.codeheadsystems.vigil.server.MutableClock;
import com.codeheadsystems.vigil.server.SignalFixtures;
import com.codeheadsystems.vigil.server.config.AuthConfig;
import com.codeheadsystems.vigil.server.crypto.Argon2PinHasher;
import com.codeheadsystems.vigil.server.crypto.RandomProvider;
import com.codeheadsystems.vigil.server.event.InMemorySecurityEventSink;
import com.codeheadsystems.vigil.server.event.SecurityEventSink;
import com.codeheadsystems.vigil.server.exception.ProviderException;
import com.codeheadsystems.vigil.server.fraud.FraudAssessment;
import com.codeheadsystems.vigil.server.fraud.FraudSignalAssessor;
import com.codeheadsystems.vigil.server.store.InMemoryKeyValueStore;
import com.codeheadsystems.vigil.server.store.InMemorySessionStore;
import com.codeheadsystems.vigil.server.verifier.CredentialVerifier;
import com.codeheadsystems.vigil.server.verifier.OneTimeCodeSender;
import com.codeheadsystems.vigil.server.verifier.PinVerifier;
import com.codeheadsystems.vigil.server.verifier.PlatformAuthenticator;
import com.codeheadsystems.vigil.server.verifier.PlatformVerifier;
import com.codeheadsystems.vigil.server.verifier.PushDispatcher;
import com.codeheadsystems.vigil.server.verifier.PushVerifier;
import com.codeheadsystems.vigil.server.verifier.SmsVerifier;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuthOrchestratorTest {

  private static final AuthIdentity ALICE = AuthIdentity.of("alice");
  private static final String PHONE = "+4915112345678";

  @Mock private PlatformAuthenticator platformAuthenticator;
  @Mock private OneTimeCodeSender codeSender;
  @Mock private PushDispatcher pushDispatcher;

  private MutableClock clock;
  private InMemorySecurityEventSink events;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
    events = new InMemorySecurityEventSink();
  }

  private AuthOrchestrator orchestrator(AuthConfig config) {
    return orchestrator(config, events, null);
  }

  private AuthOrchestrator orchestrator(AuthConfig config, SecurityEventSink sink,
                                        FraudSignalAssessor fraud) {
    RandomProvider random = new RandomProvider();
    List<CredentialVerifier> verifiers = List.of(
        new PlatformVerifier(platformAuthenticator, new InMemoryKeyValueStore<>(), random, config, clock),
        new PinVerifier(new InMemoryKeyValueStore<>(), Argon2PinHasher.forTesting(), random, config, clock),
        new SmsVerifier(new InMemoryKeyValueStore<>(), codeSender, random, config, clock),
        new PushVerifier(new InMemoryKeyValueStore<>(), pushDispatcher, random, config, clock));
    return new AuthOrchestrator(config,
        new RateLimiter(new InMemoryKeyValueStore<>(), config, clock),
        new SessionManager(new InMemoryKeyValueStore<>(), new InMemorySessionStore(clock), random, config, clock),
        verifiers,
        new DeviceFingerprintGenerator(FingerprintConfig.DEFAULT, clock),
        new RiskScorer(RiskThresholds.DEFAULT),
        sink,
        fraud,
        clock);
  }

  private static AuthRequest pin(String value) {
    return AuthRequest.of(ALICE, AuthMethod.PIN, value);
  }

  private String sendSmsAndCapture(AuthOrchestrator orchestrator) {
    when(codeSender.send(eq(ALICE), eq(PHONE), anyString())).thenReturn(true);
    AuthAttemptResult sent = orchestrator.sendSmsCode(ALICE, PHONE);
    assertThat(sent.state()).isEqualTo(AuthState.AWAITING_VERIFICATION);
    assertThat(sent.nextAction()).isEqualTo(NextAction.ENTER_CODE);
    ArgumentCaptor<String> code = ArgumentCaptor.forClass(String.class);
    verify(codeSender).send(eq(ALICE), eq(PHONE), code.capture());
    return code.getValue();
  }

  // ── Fallback ──────────────────────────────────────────────────────────────

  @Test
  void authenticate_platformNotEnrolled_fallsBackToPinThenSucceeds() {
    AuthOrchestrator orchestrator = orchestrator(AuthConfig.DEFAULT);
    when(platformAuthenticator.isAvailable()).thenReturn(true);
    orchestrator.enrollPin(ALICE, "1234", "1234");

    AuthAttemptResult platform = orchestrator.authenticate(AuthRequest.of(ALICE, null, null));

    assertThat(platform.method()).isEqualTo(AuthMethod.PLATFORM);
    assertThat(platform.state()).isEqualTo(AuthState.AWAITING_NEXT_METHOD);
    assertThat(platform.errorKind()).isEqualTo(ErrorKind.NOT_ENROLLED);
    assertThat(platform.nextAction()).isEqualTo(NextAction.SWITCH_METHOD);
    assertThat(platform.nextMethod()).contains(AuthMethod.PIN);

    AuthAttemptResult pin = orchestrator.authenticate(platform.nextMethod()
        .map(m -> AuthRequest.of(ALICE, m, "1234")).orElseThrow());

    assertThat(pin.success()).isTrue();
    assertThat(pin.state()).isEqualTo(AuthState.AUTHENTICATED);
    assertThat(pin.sessionToken()).isNotBlank();
    assertThat(orchestrator.validateSession(pin.sessionToken()))
        .map(AuthSession::identity).contains(ALICE);
    assertThat(events.kinds()).containsExactly(SecurityEventKind.PIN_ENROLLED,
        SecurityEventKind.AUTH_FAILURE, SecurityEventKind.AUTH_SUCCESS);
  }

  @Test
  void authenticate_platformUnavailable_fallsBackToPin() {
    AuthOrchestrator orchestrator = orchestrator(AuthConfig.DEFAULT);
    when(platformAuthenticator.isAvailable()).thenReturn(false);

    AuthAttemptResult result = orchestrator.authenticate(AuthRequest.of(ALICE, AuthMethod.PLATFORM, null));

    assertThat(result.errorKind()).isEqualTo(ErrorKind.TRANSPORT_UNAVAILABLE);
    assertThat(result.nextMethod()).contains(AuthMethod.PIN);
  }

  @Test
  void authenticate_pinLockout_switchesToSmsAndCorrectPinStaysLocked() {
    AuthOrchestrator orchestrator = orchestrator(AuthConfig.DEFAULT);
    orchestrator.enrollPin(ALICE, "1234", "1234");

    for (int i = 0; i < 4; i++) {
      AuthAttemptResult wrong = orchestrator.authenticate(pin("0000"));
      assertThat(wrong.errorKind()).isEqualTo(ErrorKind.CREDENTIAL_MISMATCH);
      assertThat(wrong.nextMethod()).contains(AuthMethod.SMS);
    }
    AuthAttemptResult fifth = orchestrator.authenticate(pin("0000"));

    assertThat(fifth.state()).isEqualTo(AuthState.LOCKED_OUT);
    assertThat(fifth.errorKind()).isEqualTo(ErrorKind.CREDENTIAL_LOCKED_OUT);
    assertThat(fifth.lockoutRemaining()).isEqualTo(Duration.ofMinutes(15));
    assertThat(fifth.nextAction()).isEqualTo(NextAction.SWITCH_METHOD);
    assertThat(fifth.nextMethod()).contains(AuthMethod.SMS);
    assertThat(events.events(SecurityEventKind.PIN_LOCKOUT)).hasSize(1);

    clock.advance(Duration.ofMinutes(1));
    AuthAttemptResult correct = orchestrator.authenticate(pin("1234"));
    assertThat(correct.state()).isEqualTo(AuthState.LOCKED_OUT);
    assertThat(correct.lockoutRemaining()).isEqualTo(Duration.ofMinutes(14));

    AuthStatus status = orchestrator.getAuthStatus(ALICE);
    assertThat(status.hasPin()).isTrue();
    assertThat(status.pinLocked()).isTrue();
    assertThat(status.pinLockoutRemaining()).isEqualTo(Duration.ofMinutes(14));
  }

  @Test
  void authenticate_malformedPin_asksToCorrectInput() {
    AuthOrchestrator orchestrator = orchestrator(AuthConfig.DEFAULT);
    orchestrator.enrollPin(ALICE, "1234", "1234");

    AuthAttemptResult result = orchestrator.authenticate(pin("12"));

    assertThat(result.errorKind()).isEqualTo(ErrorKind.INVALID_CREDENTIAL_FORMAT);
    assertThat(result.nextAction()).isEqualTo(NextAction.CORRECT_INPUT);
    assertThat(result.nextMethod()).contains(AuthMethod.PIN);
  }

  // ── SMS and push ──────────────────────────────────────────────────────────

  @Test
  void sms_sendThenVerify_authenticates() {
    AuthOrchestrator orchestrator = orchestrator(AuthConfig.DEFAULT);
    String code = sendSmsAndCapture(orchestrator);

    AuthAttemptResult result = orchestrator.authenticate(AuthRequest.of(ALICE, AuthMethod.SMS, code));

    assertThat(result.state()).isEqualTo(AuthState.AUTHENTICATED);
    assertThat(events.kinds()).containsExactly(SecurityEventKind.OTP_SENT,
        SecurityEventKind.OTP_VERIFIED, SecurityEventKind.AUTH_SUCCESS);
    AuthAttemptResult replay = orchestrator.authenticate(AuthRequest.of(ALICE, AuthMethod.SMS, code));
    assertThat(replay.success()).isFalse();
    assertThat(replay.errorKind()).isEqualTo(ErrorKind.CHALLENGE_ALREADY_RESOLVED);
    assertThat(replay.nextAction()).isEqualTo(NextAction.REQUEST_NEW_CHALLENGE);
  }

  @Test
  void sms_attemptsExhausted_locksOtpAndFallsBackToPush() {
    AuthOrchestrator orchestrator = orchestrator(AuthConfig.DEFAULT);
    String code = sendSmsAndCapture(orchestrator);
    String wrong = code.equals("000000") ? "111111" : "000000";

    AuthAttemptResult last = null;
    for (int i = 0; i < 3; i++) {
      last = orchestrator.authenticate(AuthRequest.of(ALICE, AuthMethod.SMS, wrong));
    }

    assertThat(last.state()).isEqualTo(AuthState.LOCKED_OUT);
    assertThat(last.errorKind()).isEqualTo(ErrorKind.CREDENTIAL_LOCKED_OUT);
    assertThat(last.lockoutRemaining()).isEqualTo(Duration.ofMinutes(5));
    assertThat(last.nextAction()).isEqualTo(NextAction.SWITCH_METHOD);
    assertThat(last.nextMethod()).contains(AuthMethod.PUSH);
    assertThat(events.events(SecurityEventKind.OTP_LOCKOUT)).hasSize(1);

    AuthAttemptResult correct = orchestrator.authenticate(AuthRequest.of(ALICE, AuthMethod.SMS, code));
    assertThat(correct.state()).isEqualTo(AuthState.LOCKED_OUT);
  }

  @Test
  void sms_resendDuringLockout_refusedUntilWindowCloses() {
    AuthOrchestrator orchestrator = orchestrator(AuthConfig.DEFAULT);
    String code = sendSmsAndCapture(orchestrator);
    String wrong = code.equals("000000") ? "111111" : "000000";
    for (int i = 0; i < 3; i++) {
      orchestrator.authenticate(AuthRequest.of(ALICE, AuthMethod.SMS, wrong));
    }
    clock.advance(Duration.ofMinutes(1));

    AuthAttemptResult resend = orchestrator.sendSmsCode(ALICE, PHONE);

    assertThat(resend.state()).isEqualTo(AuthState.LOCKED_OUT);
    assertThat(resend.lockoutRemaining()).isEqualTo(Duration.ofMinutes(4));
    verify(codeSender, times(1)).send(eq(ALICE), eq(PHONE), anyString());

    clock.advance(Duration.ofMinutes(4).plusSeconds(1));
    assertThat(orchestrator.sendSmsCode(ALICE, PHONE).state())
        .isEqualTo(AuthState.AWAITING_VERIFICATION);
  }

  @Test
  void sms_deliveryFails_fallsBackToPush() {
    AuthOrchestrator orchestrator = orchestrator(AuthConfig.DEFAULT);
    when(codeSender.send(any(), anyString(), anyString())).thenReturn(false);

    AuthAttemptResult result = orchestrator.sendSmsCode(ALICE, PHONE);

    assertThat(result.errorKind()).isEqualTo(ErrorKind.PROVIDER_FAILURE);
    assertThat(result.nextMethod()).contains(AuthMethod.PUSH);
  }

  @Test
  void push_approved_authenticatesOnce() {
    AuthOrchestrator orchestrator = orchestrator(AuthConfig.DEFAULT);
    when(pushDispatcher.dispatch(eq(ALICE), any())).thenReturn(PushDispatcher.DispatchResult.delivered());

    AuthAttemptResult pending = orchestrator.authenticate(AuthRequest.of(ALICE, AuthMethod.PUSH, null));
    assertThat(pending.state()).isEqualTo(AuthState.AWAITING_VERIFICATION);
    assertThat(pending.nextAction()).isEqualTo(NextAction.AWAIT_APPROVAL);
    assertThat(pending.challengeToken()).isNotBlank();

    AuthAttemptResult approved = orchestrator.resolvePushResponse(pending.challengeToken(), true);
    AuthAttemptResult again = orchestrator.resolvePushResponse(pending.challengeToken(), true);

    assertThat(approved.state()).isEqualTo(AuthState.AUTHENTICATED);
    assertThat(orchestrator.validateSession(approved.sessionToken())).isPresent();
    assertThat(again.success()).isFalse();
    assertThat(again.errorKind()).isEqualTo(ErrorKind.CHALLENGE_ALREADY_RESOLVED);
    assertThat(events.events(SecurityEventKind.AUTH_SUCCESS)).hasSize(1);
    assertThat(events.events(SecurityEventKind.PUSH_RESOLVED)).hasSize(1);
  }

  @Test
  void push_deniedAtEndOfChain_failsWithContactSupport() {
    AuthOrchestrator orchestrator = orchestrator(AuthConfig.DEFAULT);
    when(pushDispatcher.dispatch(eq(ALICE), any())).thenReturn(PushDispatcher.DispatchResult.delivered());
    AuthAttemptResult pending = orchestrator.authenticate(AuthRequest.of(ALICE, AuthMethod.PUSH, null));

    AuthAttemptResult denied = orchestrator.resolvePushResponse(pending.challengeToken(), false);

    assertThat(denied.state()).isEqualTo(AuthState.FAILED);
    assertThat(denied.nextAction()).isEqualTo(NextAction.CONTACT_SUPPORT);
    assertThat(denied.nextMethod()).isEmpty();
  }

  @Test
  void push_expired_neverAuthenticates() {
    AuthOrchestrator orchestrator = orchestrator(AuthConfig.DEFAULT);
    when(pushDispatcher.dispatch(eq(ALICE), any())).thenReturn(PushDispatcher.DispatchResult.delivered());
    AuthAttemptResult pending = orchestrator.authenticate(AuthRequest.of(ALICE, AuthMethod.PUSH, null));
    clock.advance(Duration.ofMinutes(6));

    AuthAttemptResult late = orchestrator.resolvePushResponse(pending.challengeToken(), true);

    assertThat(late.success()).isFalse();
    assertThat(late.errorKind()).isEqualTo(ErrorKind.CHALLENGE_EXPIRED);
  }

  // ── Guards ────────────────────────────────────────────────────────────────

  @Test
  void authenticate_overRateLimit_rateLimitedWithoutCallingVerifier() {
    AuthOrchestrator orchestrator = orchestrator(AuthConfig.DEFAULT.withRateLimit(Duration.ofMinutes(15), 2));
    orchestrator.enrollPin(ALICE, "1234", "1234");
    orchestrator.authenticate(pin("0000"));
    orchestrator.authenticate(pin("0000"));

    AuthAttemptResult limited = orchestrator.authenticate(pin("1234"));

    assertThat(limited.state()).isEqualTo(AuthState.RATE_LIMITED);
    assertThat(limited.errorKind()).isEqualTo(ErrorKind.RATE_LIMIT_EXCEEDED);
    assertThat(limited.nextAction()).isEqualTo(NextAction.WAIT);
    assertThat(limited.lockoutRemaining()).isEqualTo(Duration.ofMinutes(15));
    assertThat(events.events(SecurityEventKind.RATE_LIMITED)).hasSize(1);
    assertThat(events.events(SecurityEventKind.AUTH_SUCCESS)).isEmpty();
    assertThat(orchestrator.getAuthStatus(ALICE).rateLimited()).isTrue();

    clock.advance(Duration.ofMinutes(15));
    assertThat(orchestrator.authenticate(pin("1234")).success()).isTrue();
  }

  @Test
  void authenticate_highRiskDeviceWithBlocking_blocked() {
    AuthOrchestrator orchestrator = orchestrator(AuthConfig.DEFAULT.withBlockOnHighDeviceRisk(true));
    orchestrator.enrollPin(ALICE, "1234", "1234");

    AuthAttemptResult result = orchestrator.authenticate(
        pin("1234").withDeviceSignals(SignalFixtures.anonymized()));

    assertThat(result.state()).isEqualTo(AuthState.BLOCKED);
    assertThat(result.errorKind()).isEqualTo(ErrorKind.BLOCKED);
    assertThat(result.nextAction()).isEqualTo(NextAction.CONTACT_SUPPORT);
    List<SecurityEventRecord> fraud = events.events(SecurityEventKind.FRAUD_DETECTED);
    assertThat(fraud).hasSize(1);
    assertThat(fraud.get(0).riskScore()).isEqualTo(1.0);
    assertThat(fraud.get(0).deviceFingerprintId()).hasSize(64);
    assertThat(events.events(SecurityEventKind.ACCOUNT_LOCKED)).hasSize(1);
  }

  @Test
  void authenticate_highRiskDeviceWithoutBlocking_proceedsAndRecordsRisk() {
    AuthOrchestrator orchestrator = orchestrator(AuthConfig.DEFAULT);
    orchestrator.enrollPin(ALICE, "1234", "1234");

    AuthAttemptResult result = orchestrator.authenticate(
        pin("1234").withDeviceSignals(SignalFixtures.anonymized()));

    assertThat(result.success()).isTrue();
    assertThat(events.events(SecurityEventKind.AUTH_SUCCESS).get(0).riskScore()).isEqualTo(1.0);
  }

  @Test
  void authenticate_fraudAssessorBlocks_blocked() {
    FraudSignalAssessor fraud = mock(FraudSignalAssessor.class);
    when(fraud.assess(eq(ALICE), any(), any())).thenReturn(
        new FraudAssessment(true, 0.9, List.of("impossible travel"), false));
    AuthOrchestrator orchestrator = orchestrator(AuthConfig.DEFAULT, events, fraud);

    AuthAttemptResult result = orchestrator.authenticate(pin("1234"));

    assertThat(result.state()).isEqualTo(AuthState.BLOCKED);
    assertThat(events.events(SecurityEventKind.FRAUD_DETECTED).get(0).metadata())
        .containsEntry("anomalies", "impossible travel");
  }

  @Test
  void authenticate_fraudAssessorFails_proceeds() {
    FraudSignalAssessor fraud = mock(FraudSignalAssessor.class);
    when(fraud.assess(any(), any(), any())).thenThrow(new ProviderException("fraud service down"));
    AuthOrchestrator orchestrator = orchestrator(AuthConfig.DEFAULT, events, fraud);
    orchestrator.enrollPin(ALICE, "1234", "1234");

    assertThat(orchestrator.authenticate(pin("1234")).success()).isTrue();
  }

  @Test
  void authenticate_eventSinkFails_outcomeUnchanged() {
    SecurityEventSink failing = mock(SecurityEventSink.class);
    doThrow(new ProviderException("audit down")).when(failing).record(any());
    AuthOrchestrator orchestrator = orchestrator(AuthConfig.DEFAULT, failing, null);
    orchestrator.enrollPin(ALICE, "1234", "1234");

    AuthAttemptResult result = orchestrator.authenticate(pin("1234"));

    assertThat(result.success()).isTrue();
    assertThat(orchestrator.validateSession(result.sessionToken())).isPresent();
  }

  @Test
  void authenticate_methodWithoutVerifier_fallsBack() {
    AuthConfig config = AuthConfig.DEFAULT;
    RandomProvider random = new RandomProvider();
    AuthOrchestrator pinOnly = new AuthOrchestrator(config,
        new RateLimiter(new InMemoryKeyValueStore<>(), config, clock),
        new SessionManager(new InMemoryKeyValueStore<>(), new InMemorySessionStore(clock), random, config, clock),
        List.of(new PinVerifier(new InMemoryKeyValueStore<>(), Argon2PinHasher.forTesting(), random, config, clock)),
        new DeviceFingerprintGenerator(FingerprintConfig.DEFAULT, clock),
        new RiskScorer(RiskThresholds.DEFAULT), events, null, clock);

    AuthAttemptResult result = pinOnly.authenticate(AuthRequest.of(ALICE, AuthMethod.PLATFORM, null));

    assertThat(result.errorKind()).isEqualTo(ErrorKind.TRANSPORT_UNAVAILABLE);
    assertThat(result.nextMethod()).contains(AuthMethod.PIN);
    verify(platformAuthenticator, never()).isAvailable();
  }

  @Test
  void authenticate_verifierThrows_providerFailure() {
    AuthOrchestrator orchestrator = orchestrator(AuthConfig.DEFAULT);
    when(platformAuthenticator.isAvailable()).thenThrow(new IllegalStateException("driver crashed"));

    AuthAttemptResult result = orchestrator.authenticate(AuthRequest.of(ALICE, AuthMethod.PLATFORM, null));

    assertThat(result.errorKind()).isEqualTo(ErrorKind.PROVIDER_FAILURE);
    assertThat(result.nextMethod()).contains(AuthMethod.PIN);
  }

  // ── Sessions ──────────────────────────────────────────────────────────────

  @Test
  void logout_revokesAndRecords() {
    AuthOrchestrator orchestrator = orchestrator(AuthConfig.DEFAULT);
    orchestrator.enrollPin(ALICE, "1234", "1234");
    String token = orchestrator.authenticate(pin("1234")).sessionToken();

    assertThat(orchestrator.logout(token)).isTrue();
    assertThat(orchestrator.logout(token)).isFalse();
    assertThat(orchestrator.validateSession(token)).isEmpty();
    assertThat(events.events(SecurityEventKind.SESSION_REVOKED)).hasSize(1);
  }

  @Test
  void validateSession_expired_recordsExpiry() {
    AuthOrchestrator orchestrator = orchestrator(AuthConfig.DEFAULT.withSessionTtl(Duration.ofMinutes(10)));
    orchestrator.enrollPin(ALICE, "1234", "1234");
    String token = orchestrator.authenticate(pin("1234")).sessionToken();
    clock.advance(Duration.ofMinutes(11));

    assertThat(orchestrator.validateSession(token)).isEmpty();
    assertThat(events.events(SecurityEventKind.SESSION_EXPIRED)).hasSize(1);
    assertThat(orchestrator.logout(token)).isFalse();
  }

  @Test
  void getAuthStatus_freshIdentity() {
    AuthOrchestrator orchestrator = orchestrator(AuthConfig.DEFAULT);

    AuthStatus status = orchestrator.getAuthStatus(ALICE);

    assertThat(status.hasPlatformCredential()).isFalse();
    assertThat(status.hasPin()).isFalse();
    assertThat(status.pinLocked()).isFalse();
    assertThat(status.rateLimited()).isFalse();
    assertThat(status.rateLimitRemaining()).isNull();
  }
}
