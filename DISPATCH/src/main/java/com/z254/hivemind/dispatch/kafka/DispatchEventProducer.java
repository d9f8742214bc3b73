package com.z254.hivemind.dispatch.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.hivemind.dispatch.config.DispatchProperties;
import com.z254.hivemind.dispatch.domain.model.ArchitectureImprovement;
import com.z254.hivemind.dispatch.service.SubmissionResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes assignments and improvement runs to Kafka.
 */
@Component
@ConditionalOnProperty(prefix = "dispatch.kafka", name = "enabled", havingValue = "true")
@Slf4j
public class DispatchEventProducer {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final DispatchProperties.KafkaProperties.TopicProperties topics;
    private final Clock clock;
    private final Counter assignmentsProduced;
    private final Counter improvementsProduced;

    public DispatchEventProducer(KafkaTemplate<String, String> kafkaTemplate,
                                 ObjectMapper objectMapper,
                                 DispatchProperties properties,
                                 Clock clock,
                                 MeterRegistry meterRegistry) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topics = properties.getKafka().getTopics();
        this.clock = clock;
        this.assignmentsProduced = Counter.builder("dispatch.kafka.assignments.produced").register(meterRegistry);
        this.improvementsProduced = Counter.builder("dispatch.kafka.improvements.produced").register(meterRegistry);
    }

    public void publishAssignment(SubmissionResult result) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("taskId", result.task().getId());
        event.put("agentId", result.routing().agentId());
        event.put("taskType", result.task().getType());
        event.put("priority", result.task().getPriority());
        event.put("score", result.routing().score());
        event.put("assignedAt", clock.instant());
        send(topics.getAssignments(), result.task().getId(), event, assignmentsProduced);
    }

    public void publishImprovements(List<ArchitectureImprovement> improvements) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("generatedAt", clock.instant());
        event.put("count", improvements.size());
        event.put("improvements", improvements);
        send(topics.getImprovements(), "improvements", event, improvementsProduced);
    }

    private void send(String topic, String key, Map<String, Object> event, Counter counter) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event for {} on {}: {}", key, topic, e.getMessage());
            return;
        }

        CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(topic, key, payload);
        future.whenComplete((sendResult, ex) -> {
            if (ex != null) {
                log.error("Failed to publish {} to {}: {}", key, topic, ex.getMessage());
            } else {
                counter.increment();
                log.debug("Published {} to {} partition {} offset {}", key, topic,
                        sendResult.getRecordMetadata().partition(),
                        sendResult.getRecordMetadata().offset());
            }
        });
    }
}
