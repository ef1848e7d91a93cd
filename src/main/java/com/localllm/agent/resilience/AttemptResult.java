package com.localllm.agent.resilience;

import com.localllm.agent.exception.CircuitOpenException;

import java.util.concurrent.Callable;

/**
 * Outcome of a single attempt, already classified.
 *
 * The retry loop branches on these three cases instead of on exception types,
 * so the only place that inspects exceptions is the {@link ErrorClassifier}.
 */
public sealed interface AttemptResult<T>
        permits AttemptResult.Ok, AttemptResult.TransientFailure, AttemptResult.PermanentFailure {

    record Ok<T>(T value) implements AttemptResult<T> {}

    record TransientFailure<T>(Exception error) implements AttemptResult<T> {}

    record PermanentFailure<T>(Exception error) implements AttemptResult<T> {}

    /**
     * Runs the operation once and classifies what happened.
     * A breaker rejection is always permanent for the current call: retrying into
     * an open circuit only burns the backoff budget.
     */
    static <T> AttemptResult<T> attempt(Callable<T> operation, ErrorClassifier classifier) {
        try {
            return new Ok<>(operation.call());
        } catch (CircuitOpenException e) {
            return new PermanentFailure<>(e);
        } catch (Exception e) {
            return classifier.isRetriable(e)
                    ? new TransientFailure<>(e)
                    : new PermanentFailure<>(e);
        }
    }
}
