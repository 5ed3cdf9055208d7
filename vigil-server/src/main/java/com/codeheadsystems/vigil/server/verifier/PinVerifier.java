package com.codeheadsystems.vigil.server.verifier;

import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import com.codeheadsystems.vigil.model.auth.AuthMethod;
import com.codeheadsystems.vigil.model.auth.AuthRequest;
import com.codeheadsystems.vigil.model.auth.EnrollmentResult;
import com.codeheadsystems.vigil.model.auth.ErrorKind;
import com.codeheadsystems.vigil.server.config.AuthConfig;
import com.codeheadsystems.vigil.server.crypto.PinHasher;
import com.codeheadsystems.vigil.server.crypto.RandomProvider;
import com.codeheadsystems.vigil.server.store.KeyValueStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PIN verification with a per-credential lockout.
 * <p>
 * After {@code maxPinAttempts} consecutive wrong PINs the credential locks for
 * {@code pinLockoutDuration}; while locked every attempt is rejected, even a correct one. The
 * counter resets on success and once a lockout has passed. Malformed input is rejected before
 * the credential is touched and does not count as a failure.
 */
@Singleton
public class PinVerifier implements CredentialVerifier {

  private static final Logger log = LoggerFactory.getLogger(PinVerifier.class);
  private static final Pattern PIN_FORMAT = Pattern.compile("^\\d{4,6}$");
  private static final int SALT_BYTES = 16;

  private final KeyValueStore<AuthIdentity, PinCredential> credentials;
  private final PinHasher hasher;
  private final RandomProvider randomProvider;
  private final int maxAttempts;
  private final Duration lockoutDuration;
  private final Clock clock;

  @Inject
  public PinVerifier(final KeyValueStore<AuthIdentity, PinCredential> credentials,
                     final PinHasher hasher,
                     final RandomProvider randomProvider,
                     final AuthConfig config,
                     final Clock clock) {
    log.info("PinVerifier(maxAttempts={}, lockout={})", config.maxPinAttempts(),
        config.pinLockoutDuration());
    this.credentials = Objects.requireNonNull(credentials, "credentials");
    this.hasher = Objects.requireNonNull(hasher, "hasher");
    this.randomProvider = Objects.requireNonNull(randomProvider, "randomProvider");
    this.maxAttempts = config.maxPinAttempts();
    this.lockoutDuration = config.pinLockoutDuration();
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public static boolean isWellFormed(String pin) {
    return pin != null && PIN_FORMAT.matcher(pin).matches();
  }

  @Override
  public AuthMethod method() {
    return AuthMethod.PIN;
  }

  @Override
  public boolean isEnrolled(AuthIdentity identity) {
    return credentials.get(identity).isPresent();
  }

  /**
   * Stores a new PIN, replacing any previous one and clearing its lockout.
   *
   * @param identity     the identity
   * @param pin          the PIN
   * @param confirmation the PIN typed a second time
   * @return the enrollment result
   */
  public EnrollmentResult enroll(AuthIdentity identity, String pin, String confirmation) {
    Objects.requireNonNull(identity, "identity");
    if (!isWellFormed(pin)) {
      return EnrollmentResult.rejected(AuthMethod.PIN, ErrorKind.INVALID_CREDENTIAL_FORMAT,
          "PIN must be 4 to 6 digits");
    }
    if (!pin.equals(confirmation)) {
      return EnrollmentResult.rejected(AuthMethod.PIN, ErrorKind.CREDENTIAL_MISMATCH,
          "PIN confirmation does not match");
    }
    byte[] salt = randomProvider.randomBytes(SALT_BYTES);
    credentials.put(identity, new PinCredential(identity, hasher.hash(pin, salt), salt, 0, null));
    log.debug("enroll(identity={})", identity);
    return EnrollmentResult.enrolled(AuthMethod.PIN);
  }

  @Override
  public VerificationOutcome verify(AuthIdentity identity, AuthRequest request) {
    return verify(identity, request.credential());
  }

  /**
   * Verifies a PIN.
   *
   * @param identity the identity
   * @param pin      the candidate PIN
   * @return the outcome
   */
  public VerificationOutcome verify(AuthIdentity identity, String pin) {
    if (!isWellFormed(pin)) {
      return VerificationOutcome.rejected(ErrorKind.INVALID_CREDENTIAL_FORMAT);
    }
    while (true) {
      Optional<PinCredential> stored = credentials.get(identity);
      if (stored.isEmpty()) {
        return VerificationOutcome.rejected(ErrorKind.NOT_ENROLLED);
      }
      PinCredential current = stored.get();
      Instant now = clock.instant();
      if (current.isLockedAt(now)) {
        return VerificationOutcome.lockedOut(Duration.between(now, current.lockedUntil()));
      }
      // An elapsed lockout starts over from zero failures.
      PinCredential base = current.lockedUntil() != null ? current.cleared() : current;

      if (hasher.matches(pin, base.salt(), base.hash())) {
        PinCredential cleared = base.cleared();
        if (cleared.equals(current) || credentials.compareAndSet(identity, current, cleared)) {
          log.debug("verify(identity={}) succeeded", identity);
          return VerificationOutcome.verified();
        }
        continue;
      }

      int failures = base.failedAttempts() + 1;
      if (failures >= maxAttempts) {
        Instant lockedUntil = now.plus(lockoutDuration);
        if (credentials.compareAndSet(identity, current, base.withFailure(failures, lockedUntil))) {
          log.info("PIN locked for identity={} until {}", identity, lockedUntil);
          return VerificationOutcome.lockedOut(lockoutDuration);
        }
        continue;
      }
      if (credentials.compareAndSet(identity, current, base.withFailure(failures, null))) {
        return VerificationOutcome.mismatch(maxAttempts - failures);
      }
    }
  }

  /**
   * Remaining lockout for an identity's PIN.
   *
   * @param identity the identity
   * @return the remaining lockout, or empty if not locked or not enrolled
   */
  public Optional<Duration> lockoutRemaining(AuthIdentity identity) {
    Instant now = clock.instant();
    return credentials.get(identity)
        .filter(c -> c.isLockedAt(now))
        .map(c -> Duration.between(now, c.lockedUntil()));
  }
}
