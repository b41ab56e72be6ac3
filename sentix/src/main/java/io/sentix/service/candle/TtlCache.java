package io.sentix.service.candle;

import java.time.Duration;
import java.util.Optional;

/**
 * Key / value cache with a per-entry time to live.
 *
 * Entries are kept after they expire so callers can fall back to stale data;
 * only {@link #expire} and {@link #clear} remove them.
 */
public interface TtlCache<K, V> {

    /**
     * Value if present and still within its TTL.
     */
    Optional<V> get(K key);

    /**
     * Value regardless of age.
     */
    Optional<V> getStale(K key);

    void put(K key, V value, Duration ttl);

    void expire(K key);

    int size();

    /**
     * Number of entries still within their TTL.
     */
    int freshCount();

    void clear();
}
