package com.localllm.agent.resilience;

import java.time.Duration;

/**
 * Immutable backoff settings. Validated on construction, so an invalid
 * policy never reaches the retry loop.
 *
 * @param maxRetries     retries after the first attempt (total attempts = maxRetries + 1)
 * @param initialDelay   delay before the first retry, must be positive
 * @param maxDelay       upper bound for any single delay, at least initialDelay
 * @param multiplier     growth factor applied after each retry, at least 1
 * @param jitterFraction relative jitter in [0, 1]; 0.1 means +/-10%
 */
public record RetryPolicy(
        int maxRetries,
        Duration initialDelay,
        Duration maxDelay,
        double multiplier,
        double jitterFraction
) {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final double DEFAULT_JITTER = 0.1;

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative (was " + maxRetries + ")");
        }
        if (initialDelay == null || initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be positive (was " + initialDelay + ")");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay (was " + maxDelay + ")");
        }
        if (Double.isNaN(multiplier) || multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1 (was " + multiplier + ")");
        }
        if (Double.isNaN(jitterFraction) || jitterFraction < 0.0 || jitterFraction > 1.0) {
            throw new IllegalArgumentException("jitterFraction must be between 0 and 1 (was " + jitterFraction + ")");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY,
                DEFAULT_MULTIPLIER, DEFAULT_JITTER);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * Delay actually slept before the next attempt.
     *
     * @param baseDelay current (un-jittered) delay
     * @param unit      uniform sample in [-1, 1]
     */
    public Duration jitteredDelay(Duration baseDelay, double unit) {
        double base = baseDelay.toNanos();
        double jittered = Math.min(maxDelay.toNanos(), base + base * jitterFraction * unit);
        return Duration.ofNanos(Math.max(0L, Math.round(jittered)));
    }

    /** Base delay for the attempt after the one that used {@code baseDelay}. */
    public Duration nextDelay(Duration baseDelay) {
        double grown = baseDelay.toNanos() * multiplier;
        if (grown >= maxDelay.toNanos()) {
            return maxDelay;
        }
        return Duration.ofNanos(Math.round(grown));
    }
}
