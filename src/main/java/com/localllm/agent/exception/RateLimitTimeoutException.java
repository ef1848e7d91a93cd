package com.localllm.agent.exception;

import java.time.Duration;

/**
 * The rate limiter could not hand out a token before the caller's deadline.
 */
public class RateLimitTimeoutException extends ServiceUnavailableException {

    private final Duration timeout;

    public RateLimitTimeoutException(Duration timeout) {
        super("Rate limit: no token available within " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
