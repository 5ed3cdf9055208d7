package com.codeheadsystems.vigil.server.manager;

import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import com.codeheadsystems.vigil.model.auth.AuthMethod;
import com.codeheadsystems.vigil.model.auth.AuthSession;
import com.codeheadsystems.vigil.server.config.AuthConfig;
import com.codeheadsystems.vigil.server.crypto.RandomProvider;
import com.codeheadsystems.vigil.server.store.KeyValueStore;
import com.codeheadsystems.vigil.server.store.SessionRecord;
import com.codeheadsystems.vigil.server.store.SessionStore;
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
 * Issues, validates, refreshes and revokes sessions.
 * <p>
 * The in-memory index is authoritative. Every change is mirrored to the durable
 * {@link SessionStore} on a best-effort basis: a failing store is logged and never changes the
 * outcome. On an index miss the durable store is consulted and a live record is re-indexed.
 * <p>
 * Expiry is lazy: a session found past {@code expiresAt} during validation is revoked on the
 * spot. {@link #cleanupExpired()} exists for maintenance only.
 */
@Singleton
public class SessionManager {

  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

  /**
   * 256 bits of entropy per token.
   */
  static final int TOKEN_BYTES = 32;

  private final KeyValueStore<String, AuthSession> index;
  private final SessionStore durableStore;
  private final RandomProvider randomProvider;
  private final Duration defaultTtl;
  private final Clock clock;

  @Inject
  public SessionManager(final KeyValueStore<String, AuthSession> index,
                        final SessionStore durableStore,
                        final RandomProvider randomProvider,
                        final AuthConfig config,
                        final Clock clock) {
    log.info("SessionManager(ttl={})", config.sessionTtl());
    this.index = Objects.requireNonNull(index, "index");
    this.durableStore = Objects.requireNonNull(durableStore, "durableStore");
    this.randomProvider = Objects.requireNonNull(randomProvider, "randomProvider");
    this.defaultTtl = config.sessionTtl();
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public AuthSession createSession(AuthIdentity identity, AuthMethod method) {
    return createSession(identity, method, defaultTtl);
  }

  /**
   * Creates a session.
   *
   * @param identity the identity
   * @param method   the method that authenticated it
   * @param ttl      the lifetime
   * @return the session, carrying the new token
   */
  public AuthSession createSession(AuthIdentity identity, AuthMethod method, Duration ttl) {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(method, "method");
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive: " + ttl);
    }
    Instant now = clock.instant();
    AuthSession session;
    do {
      String token = randomProvider.randomToken(TOKEN_BYTES);
      session = new AuthSession(token, identity, method, now, now, now.plus(ttl), true);
    } while (index.putIfAbsent(session.token(), session).isPresent());
    log.debug("createSession(identity={}, method={}, token={}...)", identity, method.wireName(),
        prefix(session.token()));
    mirror(session);
    return session;
  }

  /**
   * Validate optional.
   *
   * @param token the token
   * @return the session if valid
   */
  public Optional<AuthSession> validate(String token) {
    return validateSession(token).asOptional();
  }

  /**
   * Validates a token and touches {@code lastActivityAt}; reports whether an unknown token was
   * missing or expired.
   *
   * @param token the token
   * @return the validation
   */
  public SessionValidation validateSession(String token) {
    if (token == null || token.isBlank()) {
      return SessionValidation.NOT_FOUND;
    }
    Instant now = clock.instant();
    Optional<AuthSession> indexed = index.get(token);
    AuthSession session = indexed.or(() -> lookupDurable(token)).orElse(null);
    if (session == null) {
      return SessionValidation.NOT_FOUND;
    }
    if (!session.isValidAt(now)) {
      log.debug("Session {}... expired at {}", prefix(token), session.expiresAt());
      revoke(token);
      return SessionValidation.expired(session);
    }
    if (indexed.isEmpty() && !reindex(token, session)) {
      return SessionValidation.NOT_FOUND;
    }
    while (true) {
      Optional<AuthSession> current = index.get(token);
      if (current.isEmpty()) {
        // revoked concurrently
        return SessionValidation.NOT_FOUND;
      }
      AuthSession touched = current.get().withLastActivityAt(now);
      if (index.compareAndSet(token, current.get(), touched)) {
        return SessionValidation.valid(touched);
      }
    }
  }

  /**
   * Extends a valid session to {@code now + ttl}. An expired session is revoked instead.
   *
   * @param token the token
   * @return the refreshed session, or empty if not valid
   */
  public Optional<AuthSession> refresh(String token) {
    while (true) {
      Optional<AuthSession> valid = validate(token);
      if (valid.isEmpty()) {
        return Optional.empty();
      }
      AuthSession current = valid.get();
      AuthSession extended = current.withExpiresAt(clock.instant().plus(defaultTtl));
      if (index.compareAndSet(token, current, extended)) {
        log.debug("refresh(token={}...) until {}", prefix(token), extended.expiresAt());
        mirror(extended);
        return Optional.of(extended);
      }
    }
  }

  /**
   * Revokes a session. Revoking an unknown token is a no-op.
   *
   * @param token the token
   * @return the revoked session if it was in the index
   */
  public Optional<AuthSession> revoke(String token) {
    if (token == null) {
      return Optional.empty();
    }
    // Durable first: a validation re-indexing from the durable store checks it again afterwards.
    try {
      durableStore.delete(token);
    } catch (RuntimeException e) {
      log.warn("Failed to delete session {}... from durable store", prefix(token), e);
    }
    return index.delete(token);
  }

  /**
   * Revokes every session of an identity.
   *
   * @param identity the identity
   * @return the number of sessions removed from the index
   */
  public int revokeAll(AuthIdentity identity) {
    try {
      durableStore.deleteByIdentity(identity);
    } catch (RuntimeException e) {
      log.warn("Failed to delete sessions of identity={} from durable store", identity, e);
    }
    Map<String, AuthSession> removed = index.removeIf((token, s) -> s.identity().equals(identity));
    log.debug("revokeAll(identity={}) removed {}", identity, removed.size());
    return removed.size();
  }

  /**
   * Removes every expired session from the index and the durable store.
   *
   * @return the number removed
   */
  public int cleanupExpired() {
    Instant now = clock.instant();
    Map<String, AuthSession> removed = index.removeIf((token, s) -> s.isExpiredAt(now));
    removed.keySet().forEach(token -> {
      try {
        durableStore.delete(token);
      } catch (RuntimeException e) {
        log.warn("Failed to delete expired session {}... from durable store", prefix(token), e);
      }
    });
    if (!removed.isEmpty()) {
      log.debug("cleanupExpired() removed {}", removed.size());
    }
    return removed.size();
  }

  public int activeSessionCount() {
    return index.size();
  }

  private void mirror(AuthSession session) {
    try {
      durableStore.persist(new SessionRecord(session.token(), session.identity(), session.method(),
          session.createdAt(), session.expiresAt()));
    } catch (RuntimeException e) {
      log.warn("Failed to mirror session {}... to durable store; keeping it in memory only",
          prefix(session.token()), e);
    }
  }

  /**
   * Puts a session read from the durable store back into the index, then confirms the durable
   * record still exists. A revoke that ran during the lookup removed it; the entry is taken out
   * again and the token reported as unknown.
   */
  private boolean reindex(String token, AuthSession session) {
    if (index.putIfAbsent(token, session).isPresent()) {
      return true;
    }
    if (lookupDurable(token).isPresent()) {
      return true;
    }
    index.delete(token);
    log.debug("Session {}... revoked during durable lookup; not re-indexed", prefix(token));
    return false;
  }

  private Optional<AuthSession> lookupDurable(String token) {
    try {
      return durableStore.lookup(token)
          .map(r -> new AuthSession(r.token(), r.identity(), r.method(), r.createdAt(),
              r.createdAt(), r.expiresAt(), true));
    } catch (RuntimeException e) {
      log.warn("Durable session lookup failed for {}...", prefix(token), e);
      return Optional.empty();
    }
  }

  private static String prefix(String token) {
    return token.length() <= 6 ? token : token.substring(0, 6);
  }
}
