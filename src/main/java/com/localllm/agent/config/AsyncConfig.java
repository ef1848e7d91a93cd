package com.localllm.agent.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Dedicated thread pool for chat-turn persistence.
 *
 * Kept off the web thread pool so a slow MongoDB never adds latency to a chat reply.
 * Queue capacity gives backpressure without dropping turns.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "conversationTaskExecutor")
    public Executor conversationTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("conversation-async-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
