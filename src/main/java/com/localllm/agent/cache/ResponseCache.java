package com.localllm.agent.cache;

import com.localllm.agent.resilience.TimeSource;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded in-process cache with TTL expiry and LRU eviction.
 *
 * Callers key by content (e.g. the serialized request payload); the cache stores
 * it under a SHA-256 digest so arbitrarily long inputs map to fixed-size keys.
 * Digest collisions are accepted as negligible; this is not a security boundary.
 *
 * {@link #get} hits and {@link #set} both move the entry to the most-recently-used
 * end of the map, eviction takes the other end.
 * After every mutating call {@code size() <= maxEntries}.
 *
 * Values are handed out as-is, so T should be immutable.
 */
@Slf4j
public class ResponseCache<T> {

    private final int maxEntries;
    private final Duration ttl;
    private final TimeSource timeSource;
    private volatile boolean enabled;

    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock; iteration order is least to most recently used
    private final LinkedHashMap<String, CacheEntry<T>> entries = new LinkedHashMap<>();
    private long hits;
    private long misses;
    private long evictions;

    /**
     * @param maxEntries at least 1
     * @param ttl        zero means entries never expire
     */
    public ResponseCache(int maxEntries, Duration ttl, boolean enabled, TimeSource timeSource) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1 (was " + maxEntries + ")");
        }
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be zero or positive (was " + ttl + ")");
        }
        this.maxEntries = maxEntries;
        this.ttl = ttl;
        this.enabled = enabled;
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");

        log.info("Response cache initialised [maxEntries={}, ttl={}s, enabled={}]",
                maxEntries, ttl.toSeconds(), enabled);
    }

    /**
     * Looks up the value cached for {@code content}.
     * Empty when disabled, unknown or expired; an expired entry is removed.
     */
    public Optional<T> get(String content) {
        if (!enabled) {
            return Optional.empty();
        }
        String key = keyFor(content);

        lock.lock();
        try {
            CacheEntry<T> entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (isExpired(entry, timeSource.nanoTime())) {
                entries.remove(key);
                misses++;
                log.debug("Cache entry expired [key={}]", shortKey(key));
                return Optional.empty();
            }
            hits++;
            entry.recordHit();
            moveToTail(key, entry);
            log.debug("Cache hit [key={}, entryHits={}]", shortKey(key), entry.hitCount());
            return Optional.ofNullable(entry.value());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores {@code value} for {@code content}. Replacing an existing key restarts
     * its TTL; inserting a new key into a full cache evicts the least recently used one.
     */
    public void set(String content, T value) {
        if (!enabled) {
            return;
        }
        String key = keyFor(content);

        lock.lock();
        try {
            long now = timeSource.nanoTime();
            if (entries.containsKey(key)) {
                moveToTail(key, new CacheEntry<>(value, now));
                return;
            }
            while (entries.size() >= maxEntries) {
                Iterator<Map.Entry<String, CacheEntry<T>>> eldest = entries.entrySet().iterator();
                String evicted = eldest.next().getKey();
                eldest.remove();
                evictions++;
                log.debug("Cache eviction [key={}]", shortKey(evicted));
            }
            entries.put(key, new CacheEntry<>(value, now));
            log.debug("Cache set [key={}, size={}]", shortKey(key), entries.size());
        } finally {
            lock.unlock();
        }
    }

    /** @return true if an entry was present and removed */
    public boolean invalidate(String content) {
        String key = keyFor(content);
        lock.lock();
        try {
            boolean removed = entries.remove(key) != null;
            if (removed) {
                log.debug("Cache invalidated [key={}]", shortKey(key));
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /** @return number of entries removed */
    public int clear() {
        int count;
        lock.lock();
        try {
            count = entries.size();
            entries.clear();
        } finally {
            lock.unlock();
        }
        log.info("Response cache cleared [entries={}]", count);
        return count;
    }

    /** Drops every expired entry. Always 0 when entries never expire. */
    public int cleanupExpired() {
        if (ttl.isZero()) {
            return 0;
        }
        int removed = 0;
        lock.lock();
        try {
            long now = timeSource.nanoTime();
            Iterator<CacheEntry<T>> it = entries.values().iterator();
            while (it.hasNext()) {
                if (isExpired(it.next(), now)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            log.info("Cache cleanup removed {} expired entries", removed);
        }
        return removed;
    }

    /**
     * Presence check that neither counts as a lookup nor changes recency.
     * Expired entries are reported absent.
     */
    public boolean contains(String content) {
        String key = keyFor(content);
        lock.lock();
        try {
            CacheEntry<T> entry = entries.get(key);
            return entry != null && !isExpired(entry, timeSource.nanoTime());
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

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
        log.info("Response cache {}", enabled ? "enabled" : "disabled");
    }

    public CacheStats getStats() {
        lock.lock();
        try {
            return new CacheStats(hits, misses, evictions, entries.size(), maxEntries, ttl.toSeconds(), enabled);
        } finally {
            lock.unlock();
        }
    }

    public void resetStats() {
        lock.lock();
        try {
            hits = 0;
            misses = 0;
            evictions = 0;
        } finally {
            lock.unlock();
        }
        log.info("Cache stats reset");
    }

    private void moveToTail(String key, CacheEntry<T> entry) {
        entries.remove(key);
        entries.put(key, entry);
    }

    private boolean isExpired(CacheEntry<T> entry, long nowNanos) {
        return !ttl.isZero() && nowNanos - entry.createdAtNanos() > ttl.toNanos();
    }

    static String keyFor(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(Objects.requireNonNull(content, "content").getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String shortKey(String key) {
        return key.substring(0, 16);
    }
}
