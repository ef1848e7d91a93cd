package com.localllm.agent.config;

import com.localllm.agent.cache.ResponseCache;
import com.localllm.agent.model.LlmResponse;
import com.localllm.agent.resilience.CircuitBreaker;
import com.localllm.agent.resilience.DefaultErrorClassifier;
import com.localllm.agent.resilience.ErrorClassifier;
import com.localllm.agent.resilience.RetryExecutor;
import com.localllm.agent.resilience.RetryPolicy;
import com.localllm.agent.resilience.TimeSource;
import com.localllm.agent.resilience.TokenBucketRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Wires one instance of each resilience component for the LLM backend.
 * Each component owns its own lock, so sharing these beans across request
 * threads is safe.
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    @Bean
    public TimeSource timeSource() {
        return TimeSource.SYSTEM;
    }

    @Bean
    public ErrorClassifier errorClassifier() {
        return new DefaultErrorClassifier();
    }

    @Bean
    public RetryPolicy llmRetryPolicy(ResilienceProperties props) {
        ResilienceProperties.Retry r = props.getRetry();
        return new RetryPolicy(r.getMaxRetries(), r.getInitialDelay(), r.getMaxDelay(),
                r.getExponentialBase(), r.getJitter());
    }

    @Bean
    public RetryExecutor retryExecutor(TimeSource timeSource, ErrorClassifier errorClassifier) {
        return new RetryExecutor(timeSource, () -> ThreadLocalRandom.current().nextDouble(), errorClassifier);
    }

    @Bean
    public CircuitBreaker llmCircuitBreaker(ResilienceProperties props, TimeSource timeSource) {
        ResilienceProperties.CircuitBreaker cb = props.getCircuitBreaker();
        log.info("Circuit breaker 'llm': threshold={} resetTimeout={}s",
                cb.getFailureThreshold(), cb.getResetTimeout().toSeconds());
        return new CircuitBreaker("llm", cb.getFailureThreshold(), cb.getResetTimeout(),
                cb.getHalfOpenMaxCalls(), error -> false, timeSource);
    }

    @Bean
    public TokenBucketRateLimiter llmRateLimiter(ResilienceProperties props, TimeSource timeSource) {
        ResilienceProperties.RateLimit rl = props.getRateLimit();
        TokenBucketRateLimiter limiter = TokenBucketRateLimiter.perMinute(
                rl.getRequestsPerMinute(), rl.getBurstCapacity(), rl.isEnabled(), timeSource);
        log.info("Rate limiter: enabled={} rpm={} burst={}",
                rl.isEnabled(), rl.getRequestsPerMinute(), (int) limiter.getCapacity());
        return limiter;
    }

    @Bean
    public ResponseCache<LlmResponse> llmResponseCache(ResilienceProperties props, TimeSource timeSource) {
        ResilienceProperties.Cache c = props.getCache();
        log.info("Response cache: enabled={} maxEntries={} ttl={}s",
                c.isEnabled(), c.getMaxEntries(), c.getTtl().toSeconds());
        return new ResponseCache<>(c.getMaxEntries(), c.getTtl(), c.isEnabled(), timeSource);
    }
}
