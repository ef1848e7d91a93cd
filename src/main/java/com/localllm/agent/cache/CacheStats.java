package com.localllm.agent.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CacheStats(
        long hits,
        long misses,
        long evictions,
        int size,
        int maxEntries,
        long ttlSeconds,
        boolean enabled
) {

    /** Hit rate as a percentage of all lookups; 0 before the first lookup. */
    @JsonProperty("hitRate")
    public double hitRate() {
        long total = hits + misses;
        return total > 0 ? hits * 100.0 / total : 0.0;
    }
}
