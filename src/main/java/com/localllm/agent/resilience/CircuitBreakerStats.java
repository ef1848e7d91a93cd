package com.localllm.agent.resilience;

/**
 * Snapshot of a {@link CircuitBreaker}.
 *
 * @param consecutiveFailures     current failure streak, the value compared with the threshold
 * @param millisSinceLastFailure  null when no failure was recorded since creation or reset
 */
public record CircuitBreakerStats(
        String name,
        CircuitState state,
        int consecutiveFailures,
        long failureCount,
        long successCount,
        long rejectedCalls,
        long stateChanges,
        Long millisSinceLastFailure,
        long millisSinceStateChange
) {}
