package com.localllm.agent.resilience;

import com.localllm.agent.exception.RetryExhaustedException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Runs an operation with bounded retries, exponential backoff and jitter.
 *
 * Per call:
 * - attempt the operation (through the circuit breaker when one is given)
 * - success: return immediately
 * - permanent failure: rethrow the original exception, no retry
 * - transient failure on the last attempt: throw {@link RetryExhaustedException}
 * - transient failure otherwise: sleep {@code min(maxDelay, delay +/- jitter)},
 *   grow the delay by the multiplier (capped at maxDelay) and try again
 *
 * The backoff sleep holds no lock. Cancellation is only possible between
 * attempts: interrupting the thread during a sleep ends the loop with
 * InterruptedException and the interrupt flag restored.
 *
 * One executor is safe to share between threads; only its statistics are shared.
 */
@Slf4j
public class RetryExecutor {

    private final TimeSource timeSource;
    private final DoubleSupplier uniformRandom;
    private final ErrorClassifier defaultClassifier;

    private final Object statsLock = new Object();
    private long totalAttempts;
    private long successfulRetries;
    private long failedAfterRetries;
    private double totalDelayMs;
    private double maxDelayMs;

    public RetryExecutor() {
        this(TimeSource.SYSTEM, () -> ThreadLocalRandom.current().nextDouble(), new DefaultErrorClassifier());
    }

    /**
     * @param uniformRandom source of samples in [0, 1); mapped to [-1, 1] for jitter
     */
    public RetryExecutor(TimeSource timeSource, DoubleSupplier uniformRandom, ErrorClassifier defaultClassifier) {
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
        this.uniformRandom = Objects.requireNonNull(uniformRandom, "uniformRandom");
        this.defaultClassifier = Objects.requireNonNull(defaultClassifier, "defaultClassifier");
    }

    public <T> T run(Callable<T> operation, RetryPolicy policy) throws Exception {
        return run(operation, policy, defaultClassifier, null, null);
    }

    public <T> T run(Callable<T> operation, RetryPolicy policy, ErrorClassifier classifier) throws Exception {
        return run(operation, policy, classifier, null, null);
    }

    /**
     * @param classifier decides which failures are retried; null uses the executor default
     * @param breaker    optional; every attempt is dispatched through it
     * @param listener   optional; notified before every backoff sleep
     */
    public <T> T run(Callable<T> operation,
                     RetryPolicy policy,
                     ErrorClassifier classifier,
                     CircuitBreaker breaker,
                     RetryListener listener) throws Exception {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(policy, "policy");
        ErrorClassifier effectiveClassifier = classifier != null ? classifier : defaultClassifier;
        Callable<T> attemptBody = breaker != null ? () -> breaker.call(operation) : operation;

        Duration delay = policy.initialDelay();

        for (int attempt = 1; ; attempt++) {
            AttemptResult<T> result = AttemptResult.attempt(attemptBody, effectiveClassifier);

            if (result instanceof AttemptResult.Ok<T> ok) {
                if (attempt > 1) {
                    recordSuccessfulRetry();
                    log.info("Operation succeeded after {} attempts", attempt);
                }
                return ok.value();
            }

            recordFailedAttempt();

            if (result instanceof AttemptResult.PermanentFailure<T> permanent) {
                Exception error = permanent.error();
                log.warn("Non-retriable error on attempt {}: {} ({})",
                        attempt, error.getMessage(), error.getClass().getSimpleName());
                recordCallFailure();
                throw error;
            }

            Exception error = ((AttemptResult.TransientFailure<T>) result).error();

            if (attempt >= policy.maxAttempts()) {
                log.error("Retries exhausted after {} attempts: {}", attempt, error.getMessage());
                recordCallFailure();
                throw new RetryExhaustedException(attempt, error);
            }

            Duration actualDelay = policy.jitteredDelay(delay, 2 * uniformRandom.getAsDouble() - 1);
            recordDelay(actualDelay);

            log.warn("Attempt {}/{} failed, retrying in {}ms: {} ({})",
                    attempt, policy.maxAttempts(), actualDelay.toMillis(),
                    error.getMessage(), error.getClass().getSimpleName());

            notifyListener(listener, new RetryOutcome(attempt, error, actualDelay));

            try {
                timeSource.sleep(actualDelay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                recordCallFailure();
                throw e;
            }

            delay = policy.nextDelay(delay);
        }
    }

    public RetryStats getStats() {
        synchronized (statsLock) {
            return new RetryStats(totalAttempts, successfulRetries, failedAfterRetries, totalDelayMs, maxDelayMs);
        }
    }

    public void resetStats() {
        synchronized (statsLock) {
            totalAttempts = 0;
            successfulRetries = 0;
            failedAfterRetries = 0;
            totalDelayMs = 0;
            maxDelayMs = 0;
        }
        log.info("Retry stats reset");
    }

    private void notifyListener(RetryListener listener, RetryOutcome outcome) {
        if (listener == null) return;
        try {
            listener.onRetry(outcome);
        } catch (RuntimeException e) {
            log.warn("Retry listener threw, ignoring: {}", e.getMessage());
        }
    }

    private void recordFailedAttempt() {
        synchronized (statsLock) {
            totalAttempts++;
        }
    }

    private void recordSuccessfulRetry() {
        synchronized (statsLock) {
            successfulRetries++;
        }
    }

    private void recordCallFailure() {
        synchronized (statsLock) {
            failedAfterRetries++;
        }
    }

    private void recordDelay(Duration delay) {
        double ms = delay.toNanos() / 1_000_000.0;
        synchronized (statsLock) {
            totalDelayMs += ms;
            maxDelayMs = Math.max(maxDelayMs, ms);
        }
    }
}
