package com.localllm.agent.cache;

/**
 * A cached value with its insertion time. Only {@link ResponseCache} creates,
 * reads or mutates entries, always under the cache lock.
 */
final class CacheEntry<T> {

    private final T value;
    private final long createdAtNanos;
    private long hitCount;

    CacheEntry(T value, long createdAtNanos) {
        this.value = value;
        this.createdAtNanos = createdAtNanos;
    }

    T value() {
        return value;
    }

    long createdAtNanos() {
        return createdAtNanos;
    }

    long hitCount() {
        return hitCount;
    }

    void recordHit() {
        hitCount++;
    }
}
