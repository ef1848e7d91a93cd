package com.localllm.agent.cache;

import com.localllm.agent.model.LlmResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Expired entries are otherwise only dropped when looked up; this sweeps them
 * so an idle cache does not pin stale answers in memory.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CacheCleanupTask {

    private final ResponseCache<LlmResponse> llmResponseCache;

    @Scheduled(fixedDelayString = "${resilience.cache.cleanup-interval-ms:300000}",
               initialDelayString = "${resilience.cache.cleanup-interval-ms:300000}")
    public void sweep() {
        log.debug("Sweeping LLM response cache [size={}]", llmResponseCache.size());
        llmResponseCache.cleanupExpired();
    }
}
