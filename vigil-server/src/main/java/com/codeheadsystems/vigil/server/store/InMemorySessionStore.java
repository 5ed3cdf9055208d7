package com.codeheadsystems.vigil.server.store;

import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Records are also indexed by identity so {@link #deleteByIdentity} touches only that
 * identity's tokens. An identity's entry is dropped once its last token goes, so the index does
 * not grow with every identity ever seen. Expired records are evicted lazily on {@link #lookup}.
 * Everything is lost on restart; for development and tests.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final Clock clock;
  private final ConcurrentHashMap<String, SessionRecord> records = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<AuthIdentity, Set<String>> tokensByIdentity = new ConcurrentHashMap<>();

  public InMemorySessionStore(final Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void persist(SessionRecord record) {
    SessionRecord previous = records.put(record.token(), record);
    if (previous != null && !previous.identity().equals(record.identity())) {
      unindex(previous.identity(), previous.token());
    }
    tokensByIdentity.compute(record.identity(), (identity, tokens) -> {
      Set<String> set = tokens == null ? ConcurrentHashMap.newKeySet() : tokens;
      set.add(record.token());
      return set;
    });
    log.trace("persist(identity={})", record.identity());
  }

  @Override
  public Optional<SessionRecord> lookup(String token) {
    SessionRecord record = records.get(token);
    if (record == null) {
      return Optional.empty();
    }
    if (clock.instant().isAfter(record.expiresAt())) {
      // only evict the exact record read; a concurrent persist may have extended it
      if (records.remove(token, record)) {
        unindex(record.identity(), token);
        log.trace("Evicted expired session record for identity={}", record.identity());
      }
      return Optional.empty();
    }
    return Optional.of(record);
  }

  @Override
  public void delete(String token) {
    SessionRecord record = records.remove(token);
    if (record != null) {
      unindex(record.identity(), token);
    }
  }

  @Override
  public void deleteByIdentity(AuthIdentity identity) {
    Set<String> tokens = tokensByIdentity.remove(identity);
    if (tokens == null) {
      return;
    }
    int removed = 0;
    for (String token : tokens) {
      if (records.remove(token) != null) {
        removed++;
      }
    }
    log.debug("deleteByIdentity(identity={}) removed {}", identity, removed);
  }

  public int size() {
    return records.size();
  }

  /**
   * Number of identities that currently hold at least one record.
   *
   * @return the identity count
   */
  public int identityCount() {
    return tokensByIdentity.size();
  }

  private void unindex(AuthIdentity identity, String token) {
    tokensByIdentity.computeIfPresent(identity, (id, tokens) -> {
      tokens.remove(token);
      return tokens.isEmpty() ? null : tokens;
    });
  }
}
