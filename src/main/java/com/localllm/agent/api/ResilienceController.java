package com.localllm.agent.api;

import com.localllm.agent.cache.ResponseCache;
import com.localllm.agent.model.LlmResponse;
import com.localllm.agent.model.Message;
import com.localllm.agent.resilience.CircuitBreaker;
import com.localllm.agent.resilience.ResilientLlmClient;
import com.localllm.agent.resilience.RetryExecutor;
import com.localllm.agent.resilience.TokenBucketRateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diagnostics and runtime switches for the resilience layer.
 *
 * GET  /api/v1/resilience/stats
 * POST /api/v1/resilience/cache/clear
 * POST /api/v1/resilience/cache/invalidate          body: the exact message list that was sent
 * PUT  /api/v1/resilience/cache/enabled?value=
 * POST /api/v1/resilience/circuit-breaker/reset
 * POST /api/v1/resilience/rate-limit/stats/reset
 * PUT  /api/v1/resilience/rate-limit/enabled?value=
 * POST /api/v1/resilience/retry/stats/reset
 */
@RestController
@RequestMapping("/api/v1/resilience")
@RequiredArgsConstructor
@Slf4j
public class ResilienceController {

    private final RetryExecutor retryExecutor;
    private final CircuitBreaker llmCircuitBreaker;
    private final TokenBucketRateLimiter llmRateLimiter;
    private final ResponseCache<LlmResponse> llmResponseCache;
    private final ResilientLlmClient resilientLlmClient;

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("retry", retryExecutor.getStats());
        body.put("circuitBreaker", llmCircuitBreaker.getStats());
        body.put("rateLimit", llmRateLimiter.getStats());
        body.put("availableTokens", llmRateLimiter.availableTokens());
        body.put("cache", llmResponseCache.getStats());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/cache/clear")
    public ResponseEntity<Map<String, Object>> clearCache() {
        int removed = llmResponseCache.clear();
        return ResponseEntity.ok(Map.of("cleared", removed));
    }

    @PostMapping("/cache/invalidate")
    public ResponseEntity<Map<String, Object>> invalidate(@RequestBody List<Message> messages) {
        return ResponseEntity.ok(Map.of("removed", resilientLlmClient.invalidate(messages)));
    }

    @PutMapping("/cache/enabled")
    public ResponseEntity<Map<String, Object>> setCacheEnabled(@RequestParam boolean value) {
        llmResponseCache.setEnabled(value);
        return ResponseEntity.ok(Map.of("enabled", value));
    }

    @PostMapping("/circuit-breaker/reset")
    public ResponseEntity<Map<String, Object>> resetCircuitBreaker() {
        llmCircuitBreaker.reset();
        log.info("Circuit breaker '{}' reset via API", llmCircuitBreaker.getName());
        return ResponseEntity.ok(Map.of("state", llmCircuitBreaker.getState()));
    }

    @PostMapping("/rate-limit/stats/reset")
    public ResponseEntity<Void> resetRateLimitStats() {
        llmRateLimiter.resetStats();
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/rate-limit/enabled")
    public ResponseEntity<Map<String, Object>> setRateLimitEnabled(@RequestParam boolean value) {
        llmRateLimiter.setEnabled(value);
        return ResponseEntity.ok(Map.of("enabled", value));
    }

    @PostMapping("/retry/stats/reset")
    public ResponseEntity<Void> resetRetryStats() {
        retryExecutor.resetStats();
        return ResponseEntity.noContent().build();
    }
}
