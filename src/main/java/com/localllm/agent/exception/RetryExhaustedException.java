package com.localllm.agent.exception;

/**
 * Every allowed attempt failed with a retriable error. The cause is the error
 * of the last attempt.
 */
public class RetryExhaustedException extends ServiceUnavailableException {

    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastError) {
        super("Failed after " + attempts + " attempts: " + lastError.getMessage(), lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
