package com.gamerank.leaderboard.cache;

import com.gamerank.leaderboard.model.CacheStats;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Capacity-bounded LRU cache with an absolute per-entry TTL.
 *
 * <p>One lock guards both the entries and their recency order; reads take it too because a hit
 * reorders the entries. Expired entries are dropped when read and by {@link #sweepExpired()}.
 * Hit and miss counters only reset on {@link #clear()}.
 */
public class LocalCache<V> {

    private final int capacity;
    private final long ttlMillis;
    private final Clock clock;

    // access order: iteration starts at the least recently used entry
    private final LinkedHashMap<String, CacheEntry<V>> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final ReentrantLock lock = new ReentrantLock();

    private long hits;
    private long misses;

    public LocalCache(int capacity, Duration ttl, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive");
        }
        this.capacity = capacity;
        this.ttlMillis = ttl.toMillis();
        this.clock = clock;
    }

    public Optional<V> get(String key) {
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (entry.isExpired(clock.millis())) {
                entries.remove(key);
                misses++;
                return Optional.empty();
            }
            hits++;
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores the value as most recently used with a fresh TTL. When the cache is full the least
     * recently used entry is evicted first, so the capacity is never exceeded.
     */
    public void put(String key, V value) {
        lock.lock();
        try {
            long expiresAt = clock.millis() + ttlMillis;
            if (!entries.containsKey(key) && entries.size() >= capacity) {
                evictEldest();
            }
            entries.put(key, new CacheEntry<>(value, expiresAt));
        } finally {
            lock.unlock();
        }
    }

    public boolean delete(String key) {
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    public int removeByPrefix(String prefix) {
        lock.lock();
        try {
            int removed = 0;
            Iterator<String> keys = entries.keySet().iterator();
            while (keys.hasNext()) {
                if (keys.next().startsWith(prefix)) {
                    keys.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
            hits = 0;
            misses = 0;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of expired entries removed
     */
    public int sweepExpired() {
        lock.lock();
        try {
            long now = clock.millis();
            int removed = 0;
            Iterator<Map.Entry<String, CacheEntry<V>>> iterator = entries.entrySet().iterator();
            while (iterator.hasNext()) {
                if (iterator.next().getValue().isExpired(now)) {
                    iterator.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            long total = hits + misses;
            double hitRate = total > 0 ? (double) hits / total * 100 : 0.0;
            return CacheStats.builder()
                .enabled(true)
                .hits(hits)
                .misses(misses)
                .hitRate(hitRate)
                .size(entries.size())
                .capacity(capacity)
                .utilization((double) entries.size() / capacity * 100)
                .build();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    private void evictEldest() {
        Iterator<String> eldest = entries.keySet().iterator();
        if (eldest.hasNext()) {
            eldest.next();
            eldest.remove();
        }
    }

    private record CacheEntry<V>(V value, long expiresAt) {
        boolean isExpired(long nowMillis) {
            return nowMillis > expiresAt;
        }
    }
}
