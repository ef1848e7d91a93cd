package com.localllm.agent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Strongly-typed configuration for the resilience layer around the LLM client.
 * Bound from application.yml under the "resilience" prefix.
 */
@Component
@ConfigurationProperties(prefix = "resilience")
@Data
public class ResilienceProperties {

    private Retry retry = new Retry();
    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private RateLimit rateLimit = new RateLimit();
    private Cache cache = new Cache();

    @Data
    public static class Retry {
        private int maxRetries = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double exponentialBase = 2.0;
        private double jitter = 0.1;
    }

    @Data
    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private Duration resetTimeout = Duration.ofSeconds(60);
        private int halfOpenMaxCalls = 1;
    }

    @Data
    public static class RateLimit {
        private boolean enabled = false;
        private int requestsPerMinute = 60;
        /** Defaults to requestsPerMinute / 6 when unset */
        private Integer burstCapacity;
        /** Null waits indefinitely for a token */
        private Duration acquireTimeout;
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        private int maxEntries = 100;
        /** Zero means entries never expire */
        private Duration ttl = Duration.ofSeconds(3600);
        private long cleanupIntervalMs = 300_000;
    }
}
