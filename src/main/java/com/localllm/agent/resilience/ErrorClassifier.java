package com.localllm.agent.resilience;

/**
 * Pure mapping from an error to "worth retrying or not".
 * Must not have side effects; it may be called from any thread.
 */
@FunctionalInterface
public interface ErrorClassifier {

    boolean isRetriable(Throwable error);
}
