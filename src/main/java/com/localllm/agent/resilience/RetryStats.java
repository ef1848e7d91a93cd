package com.localllm.agent.resilience;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of {@link RetryExecutor} counters.
 *
 * @param totalAttempts      attempts that failed (first tries included)
 * @param successfulRetries  calls that succeeded after at least one retry
 * @param failedAfterRetries calls that ended in an error
 * @param totalDelayMs       sum of all backoff sleeps
 * @param maxDelayMs         longest single backoff sleep
 */
public record RetryStats(
        long totalAttempts,
        long successfulRetries,
        long failedAfterRetries,
        double totalDelayMs,
        double maxDelayMs
) {

    @JsonProperty("successRate")
    public double successRate() {
        return totalAttempts > 0 ? successfulRetries * 100.0 / totalAttempts : 0.0;
    }

    @JsonProperty("avgDelayMs")
    public double avgDelayMs() {
        return totalAttempts > 0 ? totalDelayMs / totalAttempts : 0.0;
    }
}
