package com.localllm.agent.resilience;

/**
 * Observer notified before each backoff sleep. Exceptions thrown by a listener
 * are logged and ignored; they never change the retry decision.
 */
@FunctionalInterface
public interface RetryListener {

    void onRetry(RetryOutcome outcome);
}
