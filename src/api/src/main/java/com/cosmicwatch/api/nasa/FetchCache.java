package com.cosmicwatch.api.nasa;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory TTL cache of upstream payloads keyed by exact request parameters.
 *
 * <p>Entries are never evicted: an expired entry stops being fresh but stays available as the
 * last-known-good value for rate-limit fallback. Concurrent writers for one key overwrite each
 * other (last writer wins).
 *
 * @param <K> request key type
 * @param <V> cached payload type
 */
public class FetchCache<K, V> {
  private final Map<K, Entry<V>> entries = new ConcurrentHashMap<>();
  private final Duration ttl;
  private final Clock clock;

  public FetchCache(Duration ttl, Clock clock) {
    this.ttl = ttl;
    this.clock = clock;
  }

  /**
   * Returns the cached payload when its age is at most the TTL.
   *
   * @param key request key
   * @return fresh payload, or null when absent or expired
   */
  public V getFresh(K key) {
    Entry<V> entry = entries.get(key);
    if (entry == null) {
      return null;
    }
    Duration age = Duration.between(entry.storedAt(), clock.instant());
    return age.compareTo(ttl) > 0 ? null : entry.payload();
  }

  /**
   * Returns the cached payload regardless of age.
   *
   * @param key request key
   * @return last stored payload, or null when the key was never stored
   */
  public V getAny(K key) {
    Entry<V> entry = entries.get(key);
    return entry == null ? null : entry.payload();
  }

  public void put(K key, V payload) {
    entries.put(key, new Entry<>(clock.instant(), payload));
  }

  private record Entry<V>(Instant storedAt, V payload) {}
}
