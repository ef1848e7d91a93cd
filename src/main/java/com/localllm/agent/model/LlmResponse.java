package com.localllm.agent.model;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable so the same instance can be served from the response cache
 * to any number of callers.
 */
@Value
@Builder(toBuilder = true)
public class LlmResponse {

    String content;

    /** Model that produced the answer, as reported by the backend. */
    String model;

    int promptTokens;
    int completionTokens;

    /** True when served from the response cache instead of the backend. */
    boolean cached;

    public int totalTokens() {
        return promptTokens + completionTokens;
    }
}
