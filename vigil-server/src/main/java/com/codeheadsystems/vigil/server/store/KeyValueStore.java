package com.codeheadsystems.vigil.server.store;

import java.util.Map;
import java.util.Optional;
import java.util.function.BiPredicate;

/**
 * Concurrency-safe key-value storage for the engine's shared mutable state (rate-limit buckets,
 * the session index, one-time codes, push challenges, credentials).
 * <p>
 * Implementations must be thread-safe and every single-key operation must be atomic. Callers
 * build read-modify-write sequences out of {@link #compareAndSet} retry loops; there is no
 * lock spanning more than one key. Values are compared with {@link Object#equals}.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface KeyValueStore<K, V> {

  /**
   * Get optional.
   *
   * @param key the key
   * @return the current value, or empty
   */
  Optional<V> get(K key);

  /**
   * Unconditionally stores a value.
   *
   * @param key   the key
   * @param value the value
   */
  void put(K key, V value);

  /**
   * Stores the value only if the key is absent.
   *
   * @param key   the key
   * @param value the value
   * @return the value that was already present, or empty if this call stored {@code value}
   */
  Optional<V> putIfAbsent(K key, V value);

  /**
   * Replaces the value only if the current value equals {@code expected}.
   *
   * @param key         the key
   * @param expected    the value the caller read
   * @param replacement the new value
   * @return true if replaced
   */
  boolean compareAndSet(K key, V expected, V replacement);

  /**
   * Removes a key.
   *
   * @param key the key
   * @return the removed value, or empty if absent
   */
  Optional<V> delete(K key);

  /**
   * Removes a key only if it still maps to {@code expected}.
   *
   * @param key      the key
   * @param expected the expected value
   * @return true if removed
   */
  boolean delete(K key, V expected);

  /**
   * Removes every entry matching the predicate.
   *
   * @param predicate the predicate
   * @return the removed entries
   */
  Map<K, V> removeIf(BiPredicate<K, V> predicate);

  int size();
}
