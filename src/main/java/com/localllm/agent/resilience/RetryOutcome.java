package com.localllm.agent.resilience;

import java.time.Duration;

/**
 * A failed attempt that is about to be retried. Handed to {@link RetryListener}
 * only; never stored.
 *
 * @param attempt 1-based index of the attempt that failed
 * @param error   what the attempt threw
 * @param delay   how long the executor will wait before the next attempt
 */
public record RetryOutcome(int attempt, Exception error, Duration delay) {}
