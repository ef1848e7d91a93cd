package com.localllm.agent.llm;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the backend LLM client selected by LLM_PROVIDER.
 * The raw client is wrapped by ResilientLlmClient, which is what the agent gets.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Value("${llm.provider:ollama}")
    private String provider;

    // Ollama
    @Value("${llm.ollama.base-url:}")         private String ollamaBaseUrl;
    @Value("${llm.ollama.model:qwen2.5:7b-instruct}") private String ollamaModel;
    @Value("${llm.ollama.max-tokens:2048}")   private int ollamaMaxTokens;
    @Value("${llm.ollama.temperature:0.1}")   private double ollamaTemp;

    // Foundry Local
    @Value("${llm.foundry-local.base-url:}")        private String foundryBaseUrl;
    @Value("${llm.foundry-local.api-key:}")         private String foundryKey;
    @Value("${llm.foundry-local.model:phi-4}")      private String foundryModel;
    @Value("${llm.foundry-local.max-tokens:2048}")  private int foundryMaxTokens;
    @Value("${llm.foundry-local.temperature:0.1}")  private double foundryTemp;

    @PostConstruct
    public void logActiveProvider() {
        ProviderType type = ProviderType.fromId(provider);
        LlmProviderProperties props = propsFor(type);
        log.info("================================================================");
        log.info("  Active LLM Provider : {}", type.id().toUpperCase());
        log.info("  Endpoint            : {}", props.getBaseUrl());
        log.info("  Model               : {}", props.getModel());
        log.info("================================================================");
    }

    @Bean("localLlmClient")
    public LlmClient localLlmClient(@Qualifier("llmRestClientBuilder") RestClient.Builder builder) {
        ProviderType type = ProviderType.fromId(provider);
        return new GenericLlmClient(propsFor(type), type, builder.clone());
    }

    private LlmProviderProperties propsFor(ProviderType type) {
        return switch (type) {
            case OLLAMA -> ollamaProps();
            case FOUNDRY_LOCAL -> foundryProps();
        };
    }

    private LlmProviderProperties ollamaProps() {
        LlmProviderProperties p = new LlmProviderProperties();
        // Ollama does not check the key, but the OpenAI-compatible endpoint wants the header
        p.setApiKey("ollama");
        p.setBaseUrl(orDefault(ollamaBaseUrl, ProviderType.OLLAMA));
        p.setModel(ollamaModel);
        p.setMaxTokens(ollamaMaxTokens); p.setTemperature(ollamaTemp);
        return p;
    }

    private LlmProviderProperties foundryProps() {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setApiKey(foundryKey == null || foundryKey.isBlank() ? "foundry-local" : foundryKey);
        p.setBaseUrl(orDefault(foundryBaseUrl, ProviderType.FOUNDRY_LOCAL));
        p.setModel(foundryModel);
        p.setMaxTokens(foundryMaxTokens); p.setTemperature(foundryTemp);
        return p;
    }

    private String orDefault(String baseUrl, ProviderType type) {
        return baseUrl == null || baseUrl.isBlank() ? type.defaultBaseUrl() : baseUrl;
    }
}
