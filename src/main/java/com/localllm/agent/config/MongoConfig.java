package com.localllm.agent.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Enable MongoDB auditing so @CreatedDate on chat turns is populated on save.
 */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = "com.localllm.agent.conversation")
public class MongoConfig {
}
