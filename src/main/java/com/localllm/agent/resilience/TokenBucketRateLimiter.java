package com.localllm.agent.resilience;

import com.localllm.agent.exception.RateLimitTimeoutException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket admission control for outbound LLM calls.
 *
 * Tokens are fractional and refilled lazily from elapsed time on every access:
 * {@code tokens = min(capacity, tokens + elapsedSeconds * refillRatePerSecond)}.
 * Each granted request consumes exactly one token.
 *
 * The token count and refill timestamp are only touched under the instance lock.
 * Waiting for a refill happens outside the lock, then the check is repeated, so
 * several waiters can wake for the same token and some go back to sleep.
 * <b>Waiters are not served in arrival order.</b> Callers that need FIFO
 * fairness must queue in front of the limiter.
 */
@Slf4j
public class TokenBucketRateLimiter {

    private final double capacity;
    private final double refillRatePerSecond;
    private final TimeSource timeSource;
    private volatile boolean enabled;

    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private double tokens;
    private long lastRefillNanos;
    private long totalRequests;
    private long throttledRequests;
    private long rejectedRequests;
    private double totalWaitMs;
    private double maxWaitMs;
    private long windowStartNanos;

    public TokenBucketRateLimiter(double capacity, double refillRatePerSecond, boolean enabled, TimeSource timeSource) {
        if (!(capacity > 0)) {
            throw new IllegalArgumentException("capacity must be positive (was " + capacity + ")");
        }
        if (!(refillRatePerSecond > 0)) {
            throw new IllegalArgumentException("refillRatePerSecond must be positive (was " + refillRatePerSecond + ")");
        }
        this.capacity = capacity;
        this.refillRatePerSecond = refillRatePerSecond;
        this.enabled = enabled;
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
        this.tokens = capacity;
        this.lastRefillNanos = timeSource.nanoTime();
        this.windowStartNanos = lastRefillNanos;

        log.info("Rate limiter initialised [capacity={}, refillRate={}/s, enabled={}]",
                capacity, refillRatePerSecond, enabled);
    }

    /**
     * Limiter sized from a requests-per-minute budget.
     *
     * @param burstCapacity bucket size; null or non-positive defaults to {@code max(1, rpm / 6)}
     */
    public static TokenBucketRateLimiter perMinute(int requestsPerMinute, Integer burstCapacity,
                                                   boolean enabled, TimeSource timeSource) {
        if (requestsPerMinute < 1) {
            throw new IllegalArgumentException("requestsPerMinute must be positive (was " + requestsPerMinute + ")");
        }
        int capacity = burstCapacity != null && burstCapacity > 0
                ? burstCapacity
                : Math.max(1, requestsPerMinute / 6);
        return new TokenBucketRateLimiter(capacity, requestsPerMinute / 60.0, enabled, timeSource);
    }

    /** Waits as long as it takes for a token. */
    public boolean acquire() throws InterruptedException {
        return acquire(null);
    }

    /**
     * Takes one token, waiting for a refill if necessary.
     *
     * @param timeout maximum total wait; null waits indefinitely
     * @return false, without waiting further, as soon as the next token cannot
     *         arrive before the deadline
     */
    public boolean acquire(Duration timeout) throws InterruptedException {
        if (!enabled) {
            recordGranted(false, 0);
            return true;
        }

        long startNanos = timeSource.nanoTime();
        boolean waited = false;
        double waitedMs = 0;

        while (true) {
            double waitSeconds;
            lock.lock();
            try {
                refill();
                if (tokens >= 1) {
                    tokens -= 1;
                    recordGrantedLocked(waited, waitedMs);
                    return true;
                }

                waitSeconds = (1 - tokens) / refillRatePerSecond;

                if (timeout != null) {
                    double elapsedSeconds = (timeSource.nanoTime() - startNanos) / 1e9;
                    if (elapsedSeconds + waitSeconds > timeout.toNanos() / 1e9) {
                        rejectedRequests++;
                        log.debug("Rate limit timeout [waitNeeded={}ms, timeout={}ms]",
                                Math.round(waitSeconds * 1000), timeout.toMillis());
                        return false;
                    }
                }
            } finally {
                lock.unlock();
            }

            log.debug("Rate limit throttle [wait={}ms]", Math.round(waitSeconds * 1000));
            waited = true;
            waitedMs += waitSeconds * 1000;
            timeSource.sleep(Duration.ofNanos((long) Math.ceil(waitSeconds * 1e9)));
        }
    }

    /**
     * Like {@link #acquire(Duration)} but fails with {@link RateLimitTimeoutException}
     * instead of returning false.
     */
    public void acquireOrThrow(Duration timeout) throws InterruptedException {
        if (!acquire(timeout)) {
            throw new RateLimitTimeoutException(timeout);
        }
    }

    /** Takes one token if one is available right now; never waits. */
    public boolean tryAcquire() {
        if (!enabled) {
            recordGranted(false, 0);
            return true;
        }
        lock.lock();
        try {
            refill();
            if (tokens >= 1) {
                tokens -= 1;
                recordGrantedLocked(false, 0);
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /** Current token count after refill; consumes nothing. */
    public double availableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    public double getCapacity() {
        return capacity;
    }

    public double getRefillRatePerSecond() {
        return refillRatePerSecond;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
        log.info("Rate limiting {}", enabled ? "enabled" : "disabled");
    }

    public RateLimitStats getStats() {
        lock.lock();
        try {
            double windowSeconds = (timeSource.nanoTime() - windowStartNanos) / 1e9;
            return new RateLimitStats(totalRequests, throttledRequests, rejectedRequests,
                    totalWaitMs, maxWaitMs, windowSeconds);
        } finally {
            lock.unlock();
        }
    }

    public void resetStats() {
        lock.lock();
        try {
            totalRequests = 0;
            throttledRequests = 0;
            rejectedRequests = 0;
            totalWaitMs = 0;
            maxWaitMs = 0;
            windowStartNanos = timeSource.nanoTime();
        } finally {
            lock.unlock();
        }
        log.info("Rate limit stats reset");
    }

    private void refill() {
        long now = timeSource.nanoTime();
        double elapsedSeconds = (now - lastRefillNanos) / 1e9;
        lastRefillNanos = now;
        if (elapsedSeconds > 0) {
            tokens = Math.min(capacity, tokens + elapsedSeconds * refillRatePerSecond);
        }
    }

    private void recordGranted(boolean waited, double waitedMs) {
        lock.lock();
        try {
            recordGrantedLocked(waited, waitedMs);
        } finally {
            lock.unlock();
        }
    }

    private void recordGrantedLocked(boolean waited, double waitedMs) {
        totalRequests++;
        if (waited) {
            throttledRequests++;
            totalWaitMs += waitedMs;
            maxWaitMs = Math.max(maxWaitMs, waitedMs);
        }
    }
}
