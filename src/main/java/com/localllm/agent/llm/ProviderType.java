package com.localllm.agent.llm;

import java.util.Arrays;

/**
 * Local inference backends. Both expose the OpenAI chat-completions API under /v1.
 */
public enum ProviderType {

    OLLAMA("ollama", "http://localhost:11434/v1"),
    FOUNDRY_LOCAL("foundry_local", "http://127.0.0.1:55588/v1");

    private final String id;
    private final String defaultBaseUrl;

    ProviderType(String id, String defaultBaseUrl) {
        this.id = id;
        this.defaultBaseUrl = defaultBaseUrl;
    }

    public String id() {
        return id;
    }

    public String defaultBaseUrl() {
        return defaultBaseUrl;
    }

    public static ProviderType fromId(String id) {
        return Arrays.stream(values())
                .filter(p -> p.id.equalsIgnoreCase(id) || p.name().equalsIgnoreCase(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown LLM provider '" + id + "'. Use 'ollama' or 'foundry_local'."));
    }
}
