package com.localllm.agent.resilience;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of {@link TokenBucketRateLimiter} counters since creation or the last reset.
 *
 * @param totalRequests     granted requests, including those granted while disabled
 * @param throttledRequests granted requests that had to wait for a token
 * @param rejectedRequests  requests that gave up because of their timeout
 */
public record RateLimitStats(
        long totalRequests,
        long throttledRequests,
        long rejectedRequests,
        double totalWaitMs,
        double maxWaitMs,
        double windowSeconds
) {

    @JsonProperty("throttleRate")
    public double throttleRate() {
        return totalRequests > 0 ? throttledRequests * 100.0 / totalRequests : 0.0;
    }

    @JsonProperty("avgWaitMs")
    public double avgWaitMs() {
        return throttledRequests > 0 ? totalWaitMs / throttledRequests : 0.0;
    }
}
