package com.localllm.agent.llm;

import com.localllm.agent.exception.AgentException;
import com.localllm.agent.exception.PermanentFailureException;
import com.localllm.agent.exception.TransientFailureException;
import com.localllm.agent.model.LlmResponse;
import com.localllm.agent.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat client that works with Ollama and Foundry Local.
 *
 * Error handling strategy:
 *
 * | Error                    | Thrown                                      |
 * |--------------------------|---------------------------------------------|
 * | 429 / 502 / 503 / 504    | TransientFailureException (retried)         |
 * | network error / timeout  | TransientFailureException (retried)         |
 * | 401 / 403                | PermanentFailureException with key guidance |
 * | 404                      | PermanentFailureException with pull guidance|
 * | other 4xx, other 5xx     | PermanentFailureException                   |
 * | unparseable response     | AgentException (not retried)                |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private final LlmProviderProperties props;
    private final ProviderType provider;
    private final RestClient restClient;

    public GenericLlmClient(LlmProviderProperties props,
                            ProviderType provider,
                            RestClient.Builder restClientBuilder) {
        this.props = props;
        this.provider = provider;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public LlmResponse chat(List<Message> messages) {
        Map<String, Object> requestBody = buildRequestBody(messages);

        log.debug("Sending {} messages to {} [model={}]", messages.size(), provider.id(), props.getModel());

        try {
            Map<String, Object> response = restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        int status = res.getStatusCode().value();
                        log.error("{} error [{}]: {}", provider.id(), status, body);
                        throw mapErrorStatus(status, body);
                    })
                    .body(new ParameterizedTypeReference<>() {});

            if (response == null) {
                throw new AgentException(provider.id() + " returned an empty response body");
            }
            return parseResponse(response);

        } catch (ResourceAccessException e) {
            // connection refused, reset, read timeout: the backend may come back
            throw new TransientFailureException(
                    provider.id() + " unreachable at " + props.getBaseUrl() + ": " + e.getMessage(), e);
        } catch (AgentException e) {
            throw e;
        } catch (RestClientException e) {
            throw new AgentException(provider.id() + " response could not be read: " + e.getMessage(), e);
        }
    }

    @Override
    public String modelName() {
        return props.getModel();
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<String> listModels() {
        try {
            Map<String, Object> response = restClient.get()
                    .uri("/models")
                    .retrieve()
                    .body(new ParameterizedTypeReference<>() {});
            if (response == null || !(response.get("data") instanceof List<?> data)) {
                return List.of();
            }
            return ((List<Map<String, Object>>) data).stream()
                    .map(m -> (String) m.get("id"))
                    .toList();
        } catch (RestClientException e) {
            throw new TransientFailureException(provider.id() + " model listing failed: " + e.getMessage(), e);
        }
    }

    /**
     * Maps a backend error status to the exception type the retry layer expects.
     */
    AgentException mapErrorStatus(int status, String body) {
        return switch (status) {
            case 429 -> new TransientFailureException(
                    provider.id() + " is rate limiting requests. Will retry.", status, null);
            case 502, 503, 504 -> new TransientFailureException(
                    provider.id() + " temporarily unavailable [" + status + "]", status, null);
            case 401, 403 -> new PermanentFailureException(
                    provider.id() + " rejected the credentials [" + status + "]. Check llm." + provider.id() + ".api-key.",
                    status);
            case 404 -> new PermanentFailureException(
                    "Model '" + props.getModel() + "' was not found on " + provider.id() + ". "
                            + (provider == ProviderType.OLLAMA
                                ? "Pull it first with: ollama pull " + props.getModel()
                                : "Load it first with: foundry model run " + props.getModel()),
                    status);
            default -> new PermanentFailureException(
                    provider.id() + " " + (status >= 500 ? "server" : "client") + " error [" + status + "]: " + body,
                    status);
        };
    }

    private Map<String, Object> buildRequestBody(List<Message> messages) {
        List<Map<String, Object>> formattedMessages = messages.stream()
                .map(this::formatMessage)
                .toList();

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("messages", formattedMessages);
        body.put("stream", false);
        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", msg.getRole().name());
        m.put("content", msg.getContent() != null ? msg.getContent() : "");
        return m;
    }

    @SuppressWarnings("unchecked")
    private LlmResponse parseResponse(Map<String, Object> response) {
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new AgentException(provider.id() + " returned no choices in response");
        }

        int promptTokens = 0, completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens     = ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("completion_tokens", 0)).intValue();
            log.debug("Token usage: prompt={} completion={}", promptTokens, completionTokens);
        }

        Map<String, Object> choice  = choices.get(0);
        Map<String, Object> message = (Map<String, Object>) choice.get("message");
        if (message == null) {
            throw new AgentException(provider.id() + " returned a choice without a message");
        }

        log.debug("{} finish_reason: {}", provider.id(), choice.get("finish_reason"));

        Object model = response.get("model");
        return LlmResponse.builder()
                .content((String) message.get("content"))
                .model(model != null ? model.toString() : props.getModel())
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }
}
