package io.sentix.service.candle;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory TTL cache backed by a ConcurrentHashMap of immutable entries.
 * Time comes from the injected clock.
 */
public final class InMemoryTtlCache<K, V> implements TtlCache<K, V> {

    private final ConcurrentHashMap<K, Entry<V>> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTtlCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<V> get(K key) {
        Entry<V> entry = entries.get(key);
        if (entry == null || !entry.isFresh(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public Optional<V> getStale(K key) {
        Entry<V> entry = entries.get(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    @Override
    public void put(K key, V value, Duration ttl) {
        if (value == null) {
            throw new IllegalArgumentException("Cached value cannot be null");
        }
        entries.put(key, new Entry<>(value, clock.instant().plus(ttl)));
    }

    @Override
    public void expire(K key) {
        entries.remove(key);
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public int freshCount() {
        Instant now = clock.instant();
        int fresh = 0;
        for (Entry<V> entry : entries.values()) {
            if (entry.isFresh(now)) {
                fresh++;
            }
        }
        return fresh;
    }

    @Override
    public void clear() {
        entries.clear();
    }

    private record Entry<V>(V value, Instant expiresAt) {
        boolean isFresh(Instant now) {
            return now.isBefore(expiresAt);
        }
    }
}
