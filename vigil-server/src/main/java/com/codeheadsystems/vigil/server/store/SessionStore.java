package com.codeheadsystems.vigil.server.store;

import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import java.util.Optional;

/**
 * Durable storage for sessions.
 * <p>
 * The session manager's in-memory index is authoritative; this store is a best-effort mirror
 * used to recover sessions the index does not know, e.g. after a restart. Any method may throw
 * a {@link RuntimeException} on infrastructure failure; callers log it and carry on.
 * <p>
 * Implementations must be thread-safe and must support {@link #deleteByIdentity} without a
 * full scan.
 */
public interface SessionStore {

  /**
   * Persists a session, replacing any record with the same token.
   *
   * @param record the session record
   */
  void persist(SessionRecord record);

  /**
   * Looks up a session by token, returning empty if not found or expired.
   *
   * @param token the session token
   * @return the record, or empty
   */
  Optional<SessionRecord> lookup(String token);

  /**
   * Deletes a session. Deleting an unknown token is a no-op.
   *
   * @param token the session token
   */
  void delete(String token);

  /**
   * Deletes every session of an identity.
   *
   * @param identity the identity
   */
  void deleteByIdentity(AuthIdentity identity);
}
