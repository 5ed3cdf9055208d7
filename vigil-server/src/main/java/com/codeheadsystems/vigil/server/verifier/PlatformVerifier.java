package com.codeheadsystems.vigil.server.verifier;

import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import com.codeheadsystems.vigil.model.auth.AuthMethod;
import com.codeheadsystems.vigil.model.auth.AuthRequest;
import com.codeheadsystems.vigil.model.auth.EnrollmentResult;
import com.codeheadsystems.vigil.model.auth.ErrorKind;
import com.codeheadsystems.vigil.server.config.AuthConfig;
import com.codeheadsystems.vigil.server.crypto.RandomProvider;
import com.codeheadsystems.vigil.server.store.KeyValueStore;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Platform (biometric / hardware) assertion verifier.
 * <p>
 * Issues a fresh 32-byte challenge, waits at most {@code platformTimeout} for the assertion and
 * accepts it only if it comes from the enrolled credential and echoes the challenge. A timed-out
 * request is cancelled so that a late assertion can never be used.
 */
@Singleton
public class PlatformVerifier implements CredentialVerifier {

  private static final Logger log = LoggerFactory.getLogger(PlatformVerifier.class);
  private static final int CHALLENGE_BYTES = 32;

  private final PlatformAuthenticator authenticator;
  private final KeyValueStore<AuthIdentity, PlatformCredential> credentials;
  private final RandomProvider randomProvider;
  private final Duration timeout;
  private final Clock clock;

  @Inject
  public PlatformVerifier(final PlatformAuthenticator authenticator,
                          final KeyValueStore<AuthIdentity, PlatformCredential> credentials,
                          final RandomProvider randomProvider,
                          final AuthConfig config,
                          final Clock clock) {
    log.info("PlatformVerifier(timeout={})", config.platformTimeout());
    this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
    this.credentials = Objects.requireNonNull(credentials, "credentials");
    this.randomProvider = Objects.requireNonNull(randomProvider, "randomProvider");
    this.timeout = config.platformTimeout();
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public AuthMethod method() {
    return AuthMethod.PLATFORM;
  }

  @Override
  public boolean isEnrolled(AuthIdentity identity) {
    return credentials.get(identity).isPresent();
  }

  @Override
  public VerificationOutcome verify(AuthIdentity identity, AuthRequest request) {
    if (!authenticator.isAvailable()) {
      return VerificationOutcome.rejected(ErrorKind.TRANSPORT_UNAVAILABLE);
    }
    Optional<PlatformCredential> credential = credentials.get(identity);
    if (credential.isEmpty()) {
      return VerificationOutcome.rejected(ErrorKind.NOT_ENROLLED);
    }
    byte[] challenge = randomProvider.randomBytes(CHALLENGE_BYTES);
    Duration attemptTimeout = request == null ? timeout : request.timeoutOr(timeout);
    Optional<PlatformAssertion> assertion;
    try {
      assertion = await(authenticator.requestAssertion(identity, credential.get().credentialId(),
          challenge), attemptTimeout);
    } catch (TimeoutException e) {
      log.debug("Platform assertion for identity={} timed out after {}", identity, attemptTimeout);
      return VerificationOutcome.rejected(ErrorKind.CHALLENGE_EXPIRED);
    } catch (ExecutionException e) {
      log.warn("Platform authenticator failed for identity={}", identity, e.getCause());
      return VerificationOutcome.rejected(ErrorKind.PROVIDER_FAILURE);
    }
    if (assertion == null || assertion.isEmpty()) {
      log.debug("Platform assertion cancelled for identity={}", identity);
      return VerificationOutcome.rejected(ErrorKind.CREDENTIAL_MISMATCH);
    }
    PlatformAssertion signed = assertion.get();
    boolean sameCredential = credential.get().credentialId().equals(signed.credentialId());
    boolean sameChallenge = signed.challenge() != null
        && Arrays.constantTimeAreEqual(challenge, signed.challenge());
    if (!sameCredential || !sameChallenge) {
      log.info("Platform assertion rejected for identity={} (credential match={}, challenge match={})",
          identity, sameCredential, sameChallenge);
      return VerificationOutcome.rejected(ErrorKind.CREDENTIAL_MISMATCH);
    }
    return VerificationOutcome.verified();
  }

  /**
   * Registers a platform credential for the identity.
   *
   * @param identity    the identity
   * @param displayName label for the credential
   * @return the enrollment result
   */
  public EnrollmentResult enroll(AuthIdentity identity, String displayName) {
    Objects.requireNonNull(identity, "identity");
    if (!authenticator.isAvailable()) {
      return EnrollmentResult.rejected(AuthMethod.PLATFORM, ErrorKind.TRANSPORT_UNAVAILABLE,
          "Platform authenticator not available");
    }
    Optional<String> credentialId;
    try {
      credentialId = await(authenticator.createCredential(identity, displayName,
          randomProvider.randomBytes(CHALLENGE_BYTES)), timeout);
    } catch (TimeoutException e) {
      return EnrollmentResult.rejected(AuthMethod.PLATFORM, ErrorKind.CHALLENGE_EXPIRED,
          "Platform enrollment timed out");
    } catch (ExecutionException e) {
      log.warn("Platform enrollment failed for identity={}", identity, e.getCause());
      return EnrollmentResult.rejected(AuthMethod.PLATFORM, ErrorKind.PROVIDER_FAILURE,
          "Platform authenticator failed");
    }
    if (credentialId == null || credentialId.isEmpty()) {
      return EnrollmentResult.rejected(AuthMethod.PLATFORM, ErrorKind.CREDENTIAL_MISMATCH,
          "Platform enrollment cancelled");
    }
    credentials.put(identity,
        new PlatformCredential(identity, credentialId.get(), displayName, clock.instant()));
    log.debug("enroll(identity={})", identity);
    return EnrollmentResult.enrolled(AuthMethod.PLATFORM);
  }

  private <T> T await(CompletableFuture<T> future, Duration limit)
      throws TimeoutException, ExecutionException {
    try {
      return future.get(limit.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw e;
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new ExecutionException("Interrupted while waiting for the platform authenticator", e);
    }
  }
}
