package com.localllm.agent.api;

import com.localllm.agent.core.ChatAgent;
import com.localllm.agent.llm.LlmClient;
import com.localllm.agent.model.ChatRequest;
import com.localllm.agent.model.ChatResponse;
import com.localllm.agent.resilience.CircuitBreaker;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat endpoint.
 *
 * POST /api/v1/chat
 * GET  /api/v1/chat/health   backend reachability, model and breaker state
 */
@RestController
@RequestMapping("/api/v1/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final ChatAgent chatAgent;
    private final LlmClient llmClient;
    private final CircuitBreaker llmCircuitBreaker;

    @PostMapping
    public ResponseEntity<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
        log.info("Chat request [sessionId={}, userId={}]", request.getSessionId(), request.getUserId());
        return ResponseEntity.ok(chatAgent.chat(request));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("model", llmClient.modelName());
        body.put("circuitBreaker", llmCircuitBreaker.getState());
        try {
            List<String> models = llmClient.listModels();
            body.put("backend", "REACHABLE");
            body.put("modelAvailable", models.contains(llmClient.modelName()));
        } catch (RuntimeException e) {
            log.warn("LLM backend health probe failed: {}", e.getMessage());
            body.put("backend", "UNREACHABLE");
            body.put("backendError", e.getMessage());
        }
        return ResponseEntity.ok(body);
    }
}
