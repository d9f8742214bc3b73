package com.z254.hivemind.dispatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.hivemind.dispatch.domain.model.Agent;
import com.z254.hivemind.dispatch.domain.model.ArchitectureImprovement;
import com.z254.hivemind.dispatch.domain.model.FailurePattern;
import com.z254.hivemind.dispatch.domain.model.TaskPattern;
import com.z254.hivemind.dispatch.domain.repository.DocumentRepository;
import com.z254.hivemind.dispatch.domain.repository.impl.InMemoryDocumentRepository;
import com.z254.hivemind.dispatch.domain.repository.impl.RedisDocumentRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveRedisTemplate;

/**
 * Document stores for agents, learned patterns and improvements, selected by
 * {@code dispatch.persistence.backend}.
 */
@Configuration
public class PersistenceConfig {

    static final String AGENTS = "agents";
    static final String TASK_PATTERNS = "task-patterns";
    static final String FAILURE_PATTERNS = "failure-patterns";
    static final String IMPROVEMENTS = "improvements";

    @Configuration
    @ConditionalOnProperty(prefix = "dispatch.persistence", name = "backend",
            havingValue = "in-memory", matchIfMissing = true)
    static class InMemoryPersistence {

        @Bean
        public DocumentRepository<Agent> agentRepository() {
            return new InMemoryDocumentRepository<>();
        }

        @Bean
        public DocumentRepository<TaskPattern> taskPatternRepository() {
            return new InMemoryDocumentRepository<>();
        }

        @Bean
        public DocumentRepository<FailurePattern> failurePatternRepository() {
            return new InMemoryDocumentRepository<>();
        }

        @Bean
        public DocumentRepository<ArchitectureImprovement> improvementRepository() {
            return new InMemoryDocumentRepository<>();
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "dispatch.persistence", name = "backend", havingValue = "redis")
    static class RedisPersistence {

        private final ReactiveRedisTemplate<String, String> redisTemplate;
        private final ObjectMapper objectMapper;
        private final String keyPrefix;

        RedisPersistence(ReactiveRedisTemplate<String, String> redisTemplate,
                         ObjectMapper objectMapper,
                         DispatchProperties properties) {
            this.redisTemplate = redisTemplate;
            this.objectMapper = objectMapper;
            this.keyPrefix = properties.getPersistence().getKeyPrefix();
        }

        @Bean
        public DocumentRepository<Agent> agentRepository() {
            return new RedisDocumentRepository<>(redisTemplate, objectMapper, keyPrefix + AGENTS, Agent.class);
        }

        @Bean
        public DocumentRepository<TaskPattern> taskPatternRepository() {
            return new RedisDocumentRepository<>(redisTemplate, objectMapper, keyPrefix + TASK_PATTERNS,
                    TaskPattern.class);
        }

        @Bean
        public DocumentRepository<FailurePattern> failurePatternRepository() {
            return new RedisDocumentRepository<>(redisTemplate, objectMapper, keyPrefix + FAILURE_PATTERNS,
                    FailurePattern.class);
        }

        @Bean
        public DocumentRepository<ArchitectureImprovement> improvementRepository() {
            return new RedisDocumentRepository<>(redisTemplate, objectMapper, keyPrefix + IMPROVEMENTS,
                    ArchitectureImprovement.class);
        }
    }
}
