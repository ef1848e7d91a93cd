package com.localllm.agent.resilience;

import com.localllm.agent.exception.CircuitOpenException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Consecutive-failure circuit breaker for one downstream dependency.
 *
 * CLOSED    -> OPEN      after {@code threshold} consecutive failures
 * OPEN      -> HALF_OPEN on the first call at least {@code resetTimeout} after the last failure
 * HALF_OPEN -> CLOSED    when a trial call succeeds
 * HALF_OPEN -> OPEN      when a trial call fails (restarting the reset timeout)
 *
 * Only trials admitted in the current HALF_OPEN episode decide its outcome. A call
 * admitted while CLOSED, or a trial from an earlier episode, that completes during
 * HALF_OPEN only updates the counters.
 *
 * All state lives behind one lock per instance. The lock is taken twice per call,
 * once to decide whether to dispatch and once to record the outcome; the
 * operation itself runs without it. The operation's exception is always rethrown
 * unchanged.
 *
 * One breaker instance should guard exactly one logical dependency; sharing it
 * across unrelated operations mixes their failure streaks.
 */
@Slf4j
public class CircuitBreaker {

    public static final int DEFAULT_THRESHOLD = 5;
    public static final Duration DEFAULT_RESET_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_HALF_OPEN_MAX_CALLS = 1;

    private final String name;
    private final int threshold;
    private final Duration resetTimeout;
    private final int halfOpenMaxCalls;
    private final Predicate<Throwable> ignoredErrors;
    private final TimeSource timeSource;

    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private long lastFailureNanos;
    private boolean hasFailure;
    private int halfOpenCallsInFlight;
    private long halfOpenGeneration;
    private long failureCount;
    private long successCount;
    private long rejectedCalls;
    private long stateChanges;
    private long lastStateChangeNanos;

    public CircuitBreaker(String name, int threshold, Duration resetTimeout) {
        this(name, threshold, resetTimeout, DEFAULT_HALF_OPEN_MAX_CALLS, error -> false, TimeSource.SYSTEM);
    }

    /**
     * @param ignoredErrors errors matching this predicate count neither as success nor failure
     */
    public CircuitBreaker(String name,
                          int threshold,
                          Duration resetTimeout,
                          int halfOpenMaxCalls,
                          Predicate<Throwable> ignoredErrors,
                          TimeSource timeSource) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be positive (was " + threshold + ")");
        }
        if (resetTimeout == null || resetTimeout.isNegative() || resetTimeout.isZero()) {
            throw new IllegalArgumentException("resetTimeout must be positive (was " + resetTimeout + ")");
        }
        if (halfOpenMaxCalls < 1) {
            throw new IllegalArgumentException("halfOpenMaxCalls must be positive (was " + halfOpenMaxCalls + ")");
        }
        this.name = Objects.requireNonNull(name, "name");
        this.threshold = threshold;
        this.resetTimeout = resetTimeout;
        this.halfOpenMaxCalls = halfOpenMaxCalls;
        this.ignoredErrors = Objects.requireNonNull(ignoredErrors, "ignoredErrors");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
        this.lastStateChangeNanos = timeSource.nanoTime();

        log.info("Circuit breaker '{}' initialised [threshold={}, resetTimeout={}s, halfOpenMaxCalls={}]",
                name, threshold, resetTimeout.toSeconds(), halfOpenMaxCalls);
    }

    /**
     * Dispatches the operation if the breaker allows it.
     *
     * @throws CircuitOpenException when OPEN, or HALF_OPEN with every trial slot taken;
     *                              the operation is not invoked in that case
     */
    public <T> T call(Callable<T> operation) throws Exception {
        Permit permit = acquirePermit();
        T result;
        try {
            result = operation.call();
        } catch (Exception e) {
            if (ignoredErrors.test(e)) {
                onIgnored(permit);
            } else {
                onFailure(permit);
            }
            throw e;
        } catch (Error e) {
            onIgnored(permit);
            throw e;
        }
        onSuccess(permit);
        return result;
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    /** Administrative override back to CLOSED with the failure streak cleared. */
    public void reset() {
        lock.lock();
        try {
            if (state != CircuitState.CLOSED) {
                transitionTo(CircuitState.CLOSED);
            }
            consecutiveFailures = 0;
            hasFailure = false;
            halfOpenCallsInFlight = 0;
        } finally {
            lock.unlock();
        }
        log.info("Circuit breaker '{}' manually reset to CLOSED", name);
    }

    public CircuitBreakerStats getStats() {
        lock.lock();
        try {
            long now = timeSource.nanoTime();
            return new CircuitBreakerStats(
                    name,
                    state,
                    consecutiveFailures,
                    failureCount,
                    successCount,
                    rejectedCalls,
                    stateChanges,
                    hasFailure ? Duration.ofNanos(now - lastFailureNanos).toMillis() : null,
                    Duration.ofNanos(now - lastStateChangeNanos).toMillis());
        } finally {
            lock.unlock();
        }
    }

    /** Clears the cumulative counters; breaker state is left alone. */
    public void resetStats() {
        lock.lock();
        try {
            failureCount = 0;
            successCount = 0;
            rejectedCalls = 0;
            stateChanges = 0;
        } finally {
            lock.unlock();
        }
    }

    private Permit acquirePermit() {
        lock.lock();
        try {
            if (state == CircuitState.OPEN && resetTimeoutElapsed()) {
                transitionTo(CircuitState.HALF_OPEN);
                halfOpenCallsInFlight = 0;
                halfOpenGeneration++;
                log.info("Circuit breaker '{}' HALF_OPEN, allowing up to {} trial call(s)", name, halfOpenMaxCalls);
            }

            if (state == CircuitState.OPEN) {
                rejectedCalls++;
                log.warn("Circuit breaker '{}' OPEN, rejecting call [failures={}]", name, consecutiveFailures);
                throw new CircuitOpenException(
                        "Circuit breaker '" + name + "' is open (failures: " + consecutiveFailures + ")",
                        CircuitState.OPEN);
            }

            if (state == CircuitState.HALF_OPEN) {
                if (halfOpenCallsInFlight >= halfOpenMaxCalls) {
                    rejectedCalls++;
                    log.warn("Circuit breaker '{}' HALF_OPEN, trial limit reached", name);
                    throw new CircuitOpenException(
                            "Circuit breaker '" + name + "' is half-open (limit reached)",
                            CircuitState.HALF_OPEN);
                }
                halfOpenCallsInFlight++;
                return new Permit(true, halfOpenGeneration);
            }

            return new Permit(false, halfOpenGeneration);
        } finally {
            lock.unlock();
        }
    }

    private void onSuccess(Permit permit) {
        lock.lock();
        try {
            successCount++;
            if (state == CircuitState.HALF_OPEN) {
                if (isCurrentTrial(permit)) {
                    halfOpenCallsInFlight--;
                    transitionTo(CircuitState.CLOSED);
                    consecutiveFailures = 0;
                    log.info("Circuit breaker '{}' CLOSED after successful trial call", name);
                }
            } else if (state == CircuitState.CLOSED) {
                consecutiveFailures = 0;
            }
            // OPEN: a call admitted before the breaker opened finished late; the streak stands
        } finally {
            lock.unlock();
        }
    }

    private void onFailure(Permit permit) {
        lock.lock();
        try {
            failureCount++;
            if (state == CircuitState.HALF_OPEN) {
                if (isCurrentTrial(permit)) {
                    halfOpenCallsInFlight--;
                    recordFailure();
                    transitionTo(CircuitState.OPEN);
                    log.warn("Circuit breaker '{}' re-OPENED, trial call failed", name);
                }
                return;
            }
            recordFailure();
            if (state == CircuitState.CLOSED && consecutiveFailures >= threshold) {
                transitionTo(CircuitState.OPEN);
                log.warn("Circuit breaker '{}' OPENED [failures={}, threshold={}]",
                        name, consecutiveFailures, threshold);
            }
        } finally {
            lock.unlock();
        }
    }

    private void onIgnored(Permit permit) {
        lock.lock();
        try {
            if (state == CircuitState.HALF_OPEN && isCurrentTrial(permit)) {
                halfOpenCallsInFlight--;
            }
        } finally {
            lock.unlock();
        }
    }

    private boolean isCurrentTrial(Permit permit) {
        return permit.trial() && permit.generation() == halfOpenGeneration && halfOpenCallsInFlight > 0;
    }

    private void recordFailure() {
        consecutiveFailures++;
        lastFailureNanos = timeSource.nanoTime();
        hasFailure = true;
    }

    private boolean resetTimeoutElapsed() {
        return hasFailure && timeSource.nanoTime() - lastFailureNanos >= resetTimeout.toNanos();
    }

    private void transitionTo(CircuitState next) {
        state = next;
        stateChanges++;
        lastStateChangeNanos = timeSource.nanoTime();
    }

    /** Admission ticket; trial calls remember which HALF_OPEN episode admitted them. */
    private record Permit(boolean trial, long generation) {}
}
