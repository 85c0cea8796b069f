package com.delta.listener.signal.http;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Fixed-capacity LRU cache whose entries also expire after a TTL. Reads refresh recency; expired
 * entries are dropped lazily on access and during eviction sweeps.
 */
public class BoundedCache<K, V> {
    private final int maxEntries;
    private final Duration ttl;
    private final Clock clock;
    private final LinkedHashMap<K, Entry<V>> entries;

    private long hits;
    private long misses;
    private long evictions;
    private long expirations;

    public BoundedCache(int maxEntries, Duration ttl) {
        this(maxEntries, ttl, Clock.systemUTC());
    }

    public BoundedCache(int maxEntries, Duration ttl, Clock clock) {
        this.maxEntries = Math.max(1, maxEntries);
        this.ttl = ttl == null || ttl.isNegative() || ttl.isZero() ? Duration.ofMinutes(5) : ttl;
        this.clock = clock;
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    public synchronized V get(K key) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            misses++;
            return null;
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key);
            expirations++;
            misses++;
            return null;
        }
        hits++;
        return entry.value();
    }

    public synchronized void put(K key, V value) {
        if (key == null || value == null) {
            return;
        }
        entries.put(key, new Entry<>(value, clock.instant().plus(ttl)));
        while (entries.size() > maxEntries) {
            evictOne();
        }
    }

    /**
     * Returns the cached value or loads it. The loader runs outside the lock, so two threads missing on the
     * same key may both load; the last write wins. Null results are not cached.
     */
    public V getOrLoad(K key, Function<K, V> loader) {
        V cached = get(key);
        if (cached != null) {
            return cached;
        }
        V loaded = loader.apply(key);
        if (loaded != null) {
            put(key, loaded);
        }
        return loaded;
    }

    public synchronized boolean containsKey(K key) {
        Entry<V> entry = entries.get(key);
        return entry != null && !entry.isExpired(clock.instant());
    }

    public synchronized void invalidate(K key) {
        entries.remove(key);
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized CacheStats stats() {
        return new CacheStats(entries.size(), maxEntries, hits, misses, evictions, expirations);
    }

    private void evictOne() {
        Instant now = clock.instant();
        Iterator<Map.Entry<K, Entry<V>>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<K, Entry<V>> candidate = iterator.next();
            if (candidate.getValue().isExpired(now)) {
                iterator.remove();
                expirations++;
                return;
            }
        }
        iterator = entries.entrySet().iterator();
        if (iterator.hasNext()) {
            iterator.next();
            iterator.remove();
            evictions++;
        }
    }

    private record Entry<V>(V value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !expiresAt.isAfter(now);
        }
    }

    public record CacheStats(int size, int maxEntries, long hits, long misses, long evictions, long expirations) {
        public double hitRate() {
            long total = hits + misses;
            return total == 0 ? 0.0 : (double) hits / total;
        }
    }
}
