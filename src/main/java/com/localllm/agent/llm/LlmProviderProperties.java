package com.localllm.agent.llm;

import lombok.Data;

/**
 * Holds config for a single local LLM backend.
 * Populated from application.yml for ollama / foundry_local.
 */
@Data
public class LlmProviderProperties {
    private String apiKey;
    private String baseUrl;
    private String model;
    private int maxTokens;
    private double temperature;
}
