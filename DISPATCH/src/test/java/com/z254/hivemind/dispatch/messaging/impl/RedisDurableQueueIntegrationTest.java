package com.z254.hivemind.dispatch.messaging.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.hivemind.dispatch.config.DispatchProperties;
import com.z254.hivemind.dispatch.domain.model.AgentMessage;
import com.z254.hivemind.dispatch.domain.model.MessageType;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the Redis queue against a real server. Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisDurableQueueIntegrationTest {

    @Container
    static final GenericContainer<?> REDIS = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private static LettuceConnectionFactory connectionFactory;
    private static ReactiveRedisTemplate<String, String> template;

    private RedisDurableQueue queue;

    @BeforeAll
    static void connect() {
        connectionFactory = new LettuceConnectionFactory(REDIS.getHost(), REDIS.getMappedPort(6379));
        connectionFactory.afterPropertiesSet();
        template = new ReactiveRedisTemplate<>(connectionFactory, RedisSerializationContext.string());
    }

    @AfterAll
    static void disconnect() {
        connectionFactory.destroy();
    }

    @BeforeEach
    void setUp() {
        template.execute(connection -> connection.serverCommands().flushAll()).blockLast();
        DispatchProperties properties = new DispatchProperties();
        properties.getMessaging().setMaxProcessedRetained(3);
        queue = new RedisDurableQueue(template, new ObjectMapper().findAndRegisterModules(), properties);
    }

    private static AgentMessage message(String id) {
        return AgentMessage.builder()
                .id(id)
                .from("dispatcher")
                .to("agent-1")
                .type(MessageType.TASK_ASSIGNMENT)
                .content(Map.of("taskId", id))
                .timestamp(Instant.parse("2024-06-01T12:00:00Z"))
                .build();
    }

    @Test
    void drainReturnsPendingInOrderAndArchivesThem() {
        queue.append("agent-1", message("m1")).block();
        queue.append("agent-1", message("m2")).block();

        StepVerifier.create(queue.drain("agent-1"))
                .assertNext(messages -> {
                    assertThat(messages).extracting(AgentMessage::getId).containsExactly("m1", "m2");
                    assertThat(messages.get(0).getContent()).containsEntry("taskId", "m1");
                })
                .verifyComplete();

        StepVerifier.create(queue.pendingCount("agent-1")).expectNext(0L).verifyComplete();
        StepVerifier.create(template.opsForList().size(queue.processedKey("agent-1")))
                .expectNext(2L)
                .verifyComplete();
    }

    @Test
    void archiveIsTrimmedToTheRetentionLimit() {
        for (int i = 1; i <= 5; i++) {
            queue.append("agent-1", message("m" + i)).block();
        }
        queue.drain("agent-1").block();

        StepVerifier.create(template.opsForList().size(queue.processedKey("agent-1")))
                .expectNext(3L)
                .verifyComplete();
    }

    @Test
    void concurrentDrainsNeverShareAMessage() {
        for (int i = 0; i < 50; i++) {
            queue.append("agent-1", message("m" + i)).block();
        }

        List<List<AgentMessage>> drains = Flux.range(0, 6)
                .parallel()
                .runOn(Schedulers.parallel())
                .flatMap(i -> queue.drain("agent-1"))
                .sequential()
                .collectList()
                .block();

        List<String> ids = Objects.requireNonNull(drains).stream()
                .flatMap(List::stream)
                .map(AgentMessage::getId)
                .collect(Collectors.toList());
        assertThat(ids).hasSize(50).doesNotHaveDuplicates();
    }

    @Test
    void unreadableEntryStaysPendingInOrder() {
        template.opsForList().rightPush(queue.inboxKey("agent-1"), "{not json").block();
        queue.append("agent-1", message("m1")).block();
        template.opsForList().rightPush(queue.inboxKey("agent-1"), "also not json").block();

        StepVerifier.create(queue.drain("agent-1"))
                .assertNext(messages -> assertThat(messages).extracting(AgentMessage::getId).containsExactly("m1"))
                .verifyComplete();

        StepVerifier.create(template.opsForList().range(queue.inboxKey("agent-1"), 0, -1).collectList())
                .expectNext(List.of("{not json", "also not json"))
                .verifyComplete();
        StepVerifier.create(queue.drain("agent-1"))
                .expectNext(List.of())
                .verifyComplete();
        StepVerifier.create(queue.pendingCount("agent-1")).expectNext(2L).verifyComplete();
    }

    @Test
    void reportsAvailability() {
        StepVerifier.create(queue.isAvailable()).expectNext(true).verifyComplete();
    }
}
