package com.codeheadsystems.vigil.server.store;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiPredicate;

/**
 * {@link KeyValueStore} backed by a {@link ConcurrentHashMap}. State is lost on restart.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class InMemoryKeyValueStore<K, V> implements KeyValueStore<K, V> {

  private final ConcurrentHashMap<K, V> store = new ConcurrentHashMap<>();

  @Override
  public Optional<V> get(K key) {
    return Optional.ofNullable(store.get(key));
  }

  @Override
  public void put(K key, V value) {
    store.put(key, Objects.requireNonNull(value, "value"));
  }

  @Override
  public Optional<V> putIfAbsent(K key, V value) {
    return Optional.ofNullable(store.putIfAbsent(key, Objects.requireNonNull(value, "value")));
  }

  @Override
  public boolean compareAndSet(K key, V expected, V replacement) {
    return store.replace(key, expected, Objects.requireNonNull(replacement, "replacement"));
  }

  @Override
  public Optional<V> delete(K key) {
    return Optional.ofNullable(store.remove(key));
  }

  @Override
  public boolean delete(K key, V expected) {
    return store.remove(key, expected);
  }

  @Override
  public Map<K, V> removeIf(BiPredicate<K, V> predicate) {
    Map<K, V> removed = new HashMap<>();
    store.forEach((key, value) -> {
      if (predicate.test(key, value) && store.remove(key, value)) {
        removed.put(key, value);
      }
    });
    return removed;
  }

  @Override
  public int size() {
    return store.size();
  }
}
