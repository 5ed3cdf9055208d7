package com.codeheadsystems.vigil.server.verifier;

import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import com.codeheadsystems.vigil.model.auth.AuthMethod;
import com.codeheadsystems.vigil.model.auth.AuthRequest;
import com.codeheadsystems.vigil.model.auth.ErrorKind;
import com.codeheadsystems.vigil.server.config.AuthConfig;
import com.codeheadsystems.vigil.server.crypto.RandomProvider;
import com.codeheadsystems.vigil.server.store.KeyValueStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Push approval verifier.
 * <p>
 * {@link #verify} dispatches a challenge and reports it as pending. The device answers through
 * {@link #resolve}, which moves the challenge out of {@code PENDING} exactly once; any later
 * answer for the same token is rejected. An answer arriving after expiry marks the challenge
 * expired and never authenticates.
 */
@Singleton
public class PushVerifier implements CredentialVerifier {

  private static final Logger log = LoggerFactory.getLogger(PushVerifier.class);
  private static final int TOKEN_BYTES = 32;

  private final KeyValueStore<String, PushChallenge> challenges;
  private final PushDispatcher dispatcher;
  private final RandomProvider randomProvider;
  private final Duration challengeTtl;
  private final Clock clock;

  @Inject
  public PushVerifier(final KeyValueStore<String, PushChallenge> challenges,
                      final PushDispatcher dispatcher,
                      final RandomProvider randomProvider,
                      final AuthConfig config,
                      final Clock clock) {
    log.info("PushVerifier(ttl={})", config.pushChallengeTtl());
    this.challenges = Objects.requireNonNull(challenges, "challenges");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.randomProvider = Objects.requireNonNull(randomProvider, "randomProvider");
    this.challengeTtl = config.pushChallengeTtl();
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public AuthMethod method() {
    return AuthMethod.PUSH;
  }

  /**
   * Device registration is owned by the dispatcher.
   */
  @Override
  public boolean isEnrolled(AuthIdentity identity) {
    return true;
  }

  @Override
  public VerificationOutcome verify(AuthIdentity identity, AuthRequest request) {
    return sendChallenge(identity, request == null ? challengeTtl : request.timeoutOr(challengeTtl));
  }

  public VerificationOutcome sendChallenge(AuthIdentity identity) {
    return sendChallenge(identity, challengeTtl);
  }

  /**
   * Creates and dispatches a challenge that can be approved until {@code now + ttl}.
   *
   * @param identity the identity
   * @param ttl      how long the device has to answer
   * @return pending with the challenge token, or a provider failure
   */
  public VerificationOutcome sendChallenge(AuthIdentity identity, Duration ttl) {
    Objects.requireNonNull(identity, "identity");
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive: " + ttl);
    }
    Instant now = clock.instant();
    PushChallenge challenge = new PushChallenge(randomProvider.randomToken(TOKEN_BYTES), identity,
        now, now.plus(ttl), PushChallenge.Status.PENDING);
    challenges.put(challenge.token(), challenge);

    PushPayload payload = new PushPayload(challenge.token(), "Sign-in request",
        "Approve the sign-in attempt on your account", challenge.expiresAt(),
        Map.of("type", "auth_request"));
    PushDispatcher.DispatchResult result;
    try {
      result = dispatcher.dispatch(identity, payload);
    } catch (RuntimeException e) {
      log.warn("Push dispatch failed for identity={}", identity, e);
      result = PushDispatcher.DispatchResult.failed(e.getMessage());
    }
    if (result == null || !result.success()) {
      log.warn("Push dispatch rejected for identity={}: {}", identity,
          result == null ? "no result" : result.error());
      challenges.compareAndSet(challenge.token(), challenge,
          challenge.withStatus(PushChallenge.Status.FAILED));
      return VerificationOutcome.rejected(ErrorKind.PROVIDER_FAILURE);
    }
    log.debug("sendChallenge(identity={}) expires {}", identity, challenge.expiresAt());
    return VerificationOutcome.pending(challenge.token());
  }

  /**
   * Records the device's answer.
   *
   * @param token    the challenge token
   * @param approved whether the user approved
   * @return the resolution
   */
  public PushResolution resolve(String token, boolean approved) {
    while (true) {
      Optional<PushChallenge> stored = token == null ? Optional.empty() : challenges.get(token);
      if (stored.isEmpty()) {
        return new PushResolution(null, VerificationOutcome.rejected(ErrorKind.CHALLENGE_EXPIRED));
      }
      PushChallenge current = stored.get();
      if (current.status() != PushChallenge.Status.PENDING) {
        return new PushResolution(current,
            VerificationOutcome.rejected(ErrorKind.CHALLENGE_ALREADY_RESOLVED));
      }
      if (clock.instant().isAfter(current.expiresAt())) {
        PushChallenge expired = current.withStatus(PushChallenge.Status.EXPIRED);
        if (challenges.compareAndSet(token, current, expired)) {
          return new PushResolution(expired,
              VerificationOutcome.rejected(ErrorKind.CHALLENGE_EXPIRED));
        }
        continue;
      }
      PushChallenge answered = current.withStatus(
          approved ? PushChallenge.Status.APPROVED : PushChallenge.Status.DENIED);
      if (challenges.compareAndSet(token, current, answered)) {
        log.debug("resolve(identity={}, approved={})", current.identity(), approved);
        return new PushResolution(answered, approved
            ? VerificationOutcome.verified()
            : VerificationOutcome.rejected(ErrorKind.CREDENTIAL_MISMATCH));
      }
    }
  }

  public Optional<PushChallenge> challenge(String token) {
    return challenges.get(token);
  }

  /**
   * Drops challenges that are past expiry or already resolved.
   *
   * @return the number removed
   */
  public int cleanupExpired() {
    Instant now = clock.instant();
    return challenges.removeIf((token, c) ->
        c.status() != PushChallenge.Status.PENDING || now.isAfter(c.expiresAt())).size();
  }
}
