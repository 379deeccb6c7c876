package com.flamingo.ai.pagereader.service.account;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Small in-process cache whose entries expire a fixed time after they were loaded. A loader
 * failure propagates to the caller and leaves no entry behind.
 *
 * @param <K> key type
 * @param <V> value type, never null
 */
public class TtlCache<K, V> {

  private final Clock clock;
  private final Duration ttl;
  private final Map<K, Entry<V>> entries = new ConcurrentHashMap<>();

  public TtlCache(Clock clock, Duration ttl) {
    this.clock = clock;
    this.ttl = ttl;
  }

  /** Returns the cached value for {@code key}, loading it when absent or expired. */
  public V getOrRefresh(K key, Function<K, V> loader) {
    Instant now = clock.instant();
    Entry<V> cached = entries.get(key);
    if (cached != null && now.isBefore(cached.expiresAt())) {
      return cached.value();
    }
    V value = loader.apply(key);
    entries.put(key, new Entry<>(value, now.plus(ttl)));
    return value;
  }

  int size() {
    return entries.size();
  }

  private record Entry<V>(V value, Instant expiresAt) {}
}
