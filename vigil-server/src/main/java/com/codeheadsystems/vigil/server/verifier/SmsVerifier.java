package com.codeheadsystems.vigil.server.verifier;

import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import com.codeheadsystems.vigil.model.auth.AuthMethod;
import com.codeheadsystems.vigil.model.auth.AuthRequest;
import com.codeheadsystems.vigil.model.auth.ErrorKind;
import com.codeheadsystems.vigil.server.config.AuthConfig;
import com.codeheadsystems.vigil.server.crypto.RandomProvider;
import com.codeheadsystems.vigil.server.store.KeyValueStore;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SMS one-time code verifier. One active code per identity; sending a new code replaces it.
 * <p>
 * A code resolves exactly once: on success, on expiry, or when its attempts run out. Running out
 * of attempts locks one-time codes for the identity until that code would have expired. Every
 * state change is a compare-and-set on the stored code, so two concurrent verifications of the
 * same code cannot both succeed.
 */
@Singleton
public class SmsVerifier implements CredentialVerifier {

  private static final Logger log = LoggerFactory.getLogger(SmsVerifier.class);

  private final KeyValueStore<AuthIdentity, OneTimeCode> codes;
  private final OneTimeCodeSender sender;
  private final RandomProvider randomProvider;
  private final Duration expiry;
  private final int maxAttempts;
  private final int codeLength;
  private final Pattern codeFormat;
  private final Clock clock;

  @Inject
  public SmsVerifier(final KeyValueStore<AuthIdentity, OneTimeCode> codes,
                     final OneTimeCodeSender sender,
                     final RandomProvider randomProvider,
                     final AuthConfig config,
                     final Clock clock) {
    log.info("SmsVerifier(expiry={}, maxAttempts={})", config.otpExpiry(), config.maxOtpAttempts());
    this.codes = Objects.requireNonNull(codes, "codes");
    this.sender = Objects.requireNonNull(sender, "sender");
    this.randomProvider = Objects.requireNonNull(randomProvider, "randomProvider");
    this.expiry = config.otpExpiry();
    this.maxAttempts = config.maxOtpAttempts();
    this.codeLength = config.otpLength();
    this.codeFormat = Pattern.compile("^\\d{" + codeLength + "}$");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public AuthMethod method() {
    return AuthMethod.SMS;
  }

  /**
   * SMS needs no enrollment here; the phone number is supplied per send.
   */
  @Override
  public boolean isEnrolled(AuthIdentity identity) {
    return true;
  }

  /**
   * Generates, stores and sends a new code. The code is stored before delivery and discarded
   * again if delivery fails. While an exhausted code's window is still open no new code is
   * issued, so re-sending cannot reset the attempt counter.
   *
   * @param identity    the identity
   * @param phoneNumber destination
   * @return pending on delivery, locked out during an OTP lockout, otherwise a failure
   */
  public VerificationOutcome sendCode(AuthIdentity identity, String phoneNumber) {
    Objects.requireNonNull(identity, "identity");
    if (phoneNumber == null || phoneNumber.isBlank()) {
      return VerificationOutcome.rejected(ErrorKind.INVALID_CREDENTIAL_FORMAT);
    }
    Instant now = clock.instant();
    OneTimeCode code = new OneTimeCode(identity, phoneNumber, randomProvider.randomDigits(codeLength),
        now, now.plus(expiry), 0, maxAttempts, OneTimeCode.Status.ACTIVE);
    while (true) {
      Optional<OneTimeCode> previous = codes.get(identity);
      if (previous.isPresent() && previous.get().isLockingAt(now)) {
        log.debug("sendCode(identity={}) refused during OTP lockout", identity);
        return VerificationOutcome.lockedOut(Duration.between(now, previous.get().expiresAt()));
      }
      boolean stored = previous.isPresent()
          ? codes.compareAndSet(identity, previous.get(), code)
          : codes.putIfAbsent(identity, code).isEmpty();
      if (stored) {
        break;
      }
    }
    boolean delivered;
    try {
      delivered = sender.send(identity, phoneNumber, code.code());
    } catch (RuntimeException e) {
      log.warn("One-time code delivery failed for identity={}", identity, e);
      delivered = false;
    }
    if (!delivered) {
      codes.delete(identity, code);
      return VerificationOutcome.rejected(ErrorKind.PROVIDER_FAILURE);
    }
    log.debug("sendCode(identity={}) expires {}", identity, code.expiresAt());
    return VerificationOutcome.pending(null);
  }

  @Override
  public VerificationOutcome verify(AuthIdentity identity, AuthRequest request) {
    return verify(identity, request.credential());
  }

  /**
   * Verifies a code.
   *
   * @param identity the identity
   * @param input    the code the user entered
   * @return the outcome
   */
  public VerificationOutcome verify(AuthIdentity identity, String input) {
    if (input == null || !codeFormat.matcher(input).matches()) {
      return VerificationOutcome.rejected(ErrorKind.INVALID_CREDENTIAL_FORMAT);
    }
    while (true) {
      Optional<OneTimeCode> stored = codes.get(identity);
      if (stored.isEmpty()) {
        return VerificationOutcome.rejected(ErrorKind.CHALLENGE_EXPIRED);
      }
      OneTimeCode current = stored.get();
      Instant now = clock.instant();
      switch (current.status()) {
        case VERIFIED:
          return VerificationOutcome.rejected(ErrorKind.CHALLENGE_ALREADY_RESOLVED);
        case EXPIRED:
          return VerificationOutcome.rejected(ErrorKind.CHALLENGE_EXPIRED);
        case EXHAUSTED:
          return current.isLockingAt(now)
              ? VerificationOutcome.lockedOut(Duration.between(now, current.expiresAt()))
              : VerificationOutcome.rejected(ErrorKind.CHALLENGE_EXPIRED);
        default:
          break;
      }
      if (now.isAfter(current.expiresAt())) {
        if (codes.compareAndSet(identity, current, current.withStatus(OneTimeCode.Status.EXPIRED))) {
          return VerificationOutcome.rejected(ErrorKind.CHALLENGE_EXPIRED);
        }
        continue;
      }
      boolean matches = Arrays.constantTimeAreEqual(
          current.code().getBytes(StandardCharsets.US_ASCII),
          input.getBytes(StandardCharsets.US_ASCII));
      if (matches) {
        if (codes.compareAndSet(identity, current, current.attempted(OneTimeCode.Status.VERIFIED))) {
          log.debug("verify(identity={}) succeeded", identity);
          return VerificationOutcome.verified();
        }
        continue;
      }
      boolean exhausted = current.attempts() + 1 >= current.maxAttempts();
      OneTimeCode failed = current.attempted(
          exhausted ? OneTimeCode.Status.EXHAUSTED : OneTimeCode.Status.ACTIVE);
      if (codes.compareAndSet(identity, current, failed)) {
        if (exhausted) {
          log.info("One-time codes locked for identity={} until {}", identity, failed.expiresAt());
          return VerificationOutcome.lockedOut(Duration.between(now, failed.expiresAt()));
        }
        return VerificationOutcome.mismatch(failed.maxAttempts() - failed.attempts());
      }
    }
  }

  public Optional<OneTimeCode> activeCode(AuthIdentity identity) {
    return codes.get(identity).filter(OneTimeCode::isActive);
  }
}
