package com.localllm.agent.resilience;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.localllm.agent.cache.ResponseCache;
import com.localllm.agent.config.ResilienceProperties;
import com.localllm.agent.exception.AgentException;
import com.localllm.agent.llm.LlmClient;
import com.localllm.agent.model.LlmResponse;
import com.localllm.agent.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Wraps the raw backend client with cache, rate limiting, retry and circuit breaking.
 *
 * Order of a call:
 *   1. cache lookup (hit returns immediately, marked cached=true)
 *   2. one rate-limit token per logical call, not per attempt
 *   3. retry loop; every attempt goes through the circuit breaker
 *   4. successful answer is stored in the cache
 *
 * Failures surface as typed exceptions: PermanentFailureException,
 * RetryExhaustedException, CircuitOpenException or RateLimitTimeoutException.
 * Turning those into user-facing text is ChatAgent's job.
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;
    private final ErrorClassifier errorClassifier;
    private final CircuitBreaker circuitBreaker;
    private final TokenBucketRateLimiter rateLimiter;
    private final ResponseCache<LlmResponse> cache;
    private final ObjectMapper objectMapper;
    private final Duration acquireTimeout;

    public ResilientLlmClient(@Qualifier("localLlmClient") LlmClient delegate,
                              RetryExecutor retryExecutor,
                              RetryPolicy retryPolicy,
                              ErrorClassifier errorClassifier,
                              CircuitBreaker circuitBreaker,
                              TokenBucketRateLimiter rateLimiter,
                              ResponseCache<LlmResponse> cache,
                              ObjectMapper objectMapper,
                              ResilienceProperties properties) {
        this.delegate = delegate;
        this.retryExecutor = retryExecutor;
        this.retryPolicy = retryPolicy;
        this.errorClassifier = errorClassifier;
        this.circuitBreaker = circuitBreaker;
        this.rateLimiter = rateLimiter;
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.acquireTimeout = properties.getRateLimit().getAcquireTimeout();
    }

    @Override
    public LlmResponse chat(List<Message> messages) {
        return chat(messages, true);
    }

    @Override
    public LlmResponse chat(List<Message> messages, boolean useCache) {
        String cacheContent = useCache ? cacheContent(messages) : null;

        if (cacheContent != null) {
            Optional<LlmResponse> hit = cache.get(cacheContent);
            if (hit.isPresent()) {
                log.debug("Serving LLM response from cache [model={}]", delegate.modelName());
                return hit.get().toBuilder().cached(true).build();
            }
        }

        LlmResponse response;
        try {
            rateLimiter.acquireOrThrow(acquireTimeout);
            response = retryExecutor.run(() -> delegate.chat(messages), retryPolicy, errorClassifier,
                    circuitBreaker, this::onRetry);
        } catch (AgentException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentException("Interrupted while calling the LLM backend", e);
        } catch (Exception e) {
            throw new AgentException("LLM call failed: " + e.getMessage(), e);
        }

        if (cacheContent != null && response.getContent() != null && !response.getContent().isBlank()) {
            cache.set(cacheContent, response);
        }
        return response;
    }

    @Override
    public String modelName() {
        return delegate.modelName();
    }

    /** Not guarded: a health probe should report the backend as it is right now. */
    @Override
    public List<String> listModels() {
        return delegate.listModels();
    }

    /**
     * Drops the cached answer for exactly this conversation.
     *
     * @return true if an entry was removed
     */
    public boolean invalidate(List<Message> messages) {
        String cacheContent = cacheContent(messages);
        return cacheContent != null && cache.invalidate(cacheContent);
    }

    private void onRetry(RetryOutcome outcome) {
        log.info("LLM attempt {} failed, next attempt in {}ms [breaker={}]",
                outcome.attempt(), outcome.delay().toMillis(), circuitBreaker.getState());
    }

    /**
     * Cache identity is the model plus the exact message list; the cache hashes it.
     * Returns null, disabling the cache for this call, if the messages cannot be serialized.
     */
    private String cacheContent(List<Message> messages) {
        try {
            return objectMapper.writeValueAsString(new CachePayload(delegate.modelName(), messages));
        } catch (JsonProcessingException e) {
            log.warn("Could not build cache key, bypassing cache: {}", e.getMessage());
            return null;
        }
    }

    private record CachePayload(String model, List<Message> messages) {}
}
