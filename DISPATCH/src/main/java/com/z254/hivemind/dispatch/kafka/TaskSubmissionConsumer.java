package com.z254.hivemind.dispatch.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.hivemind.dispatch.api.dto.TaskSubmissionRequest;
import com.z254.hivemind.dispatch.observability.DispatchStructuredLogger;
import com.z254.hivemind.dispatch.registry.CapabilityCatalog;
import com.z254.hivemind.dispatch.service.DispatchCoordinator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Consumes task submissions from the tasks topic and routes them.
 */
@Component
@ConditionalOnProperty(prefix = "dispatch.kafka", name = "enabled", havingValue = "true")
@Slf4j
public class TaskSubmissionConsumer {

    private final DispatchCoordinator coordinator;
    private final CapabilityCatalog catalog;
    private final ObjectMapper objectMapper;
    private final DispatchStructuredLogger structuredLogger;
    private final Counter tasksConsumed;
    private final Counter tasksRejected;

    public TaskSubmissionConsumer(DispatchCoordinator coordinator,
                                  CapabilityCatalog catalog,
                                  ObjectMapper objectMapper,
                                  DispatchStructuredLogger structuredLogger,
                                  MeterRegistry meterRegistry) {
        this.coordinator = coordinator;
        this.catalog = catalog;
        this.objectMapper = objectMapper;
        this.structuredLogger = structuredLogger;
        this.tasksConsumed = Counter.builder("dispatch.kafka.tasks.consumed").register(meterRegistry);
        this.tasksRejected = Counter.builder("dispatch.kafka.tasks.rejected").register(meterRegistry);
    }

    @KafkaListener(
            topics = "${dispatch.kafka.topics.tasks:dispatch.tasks}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        tasksConsumed.increment();
        structuredLogger.setTaskContext(record.key(), null, record.key());
        log.info("Received task {} from partition {} offset {}", record.key(), record.partition(), record.offset());

        Mono.fromCallable(() -> objectMapper.readValue(record.value(), TaskSubmissionRequest.class))
                .map(request -> {
                    if (request.getId() == null) {
                        request.setId(record.key());
                    }
                    return request.toTask(catalog);
                })
                .flatMap(coordinator::submit)
                .doOnSuccess(result -> log.info("Task {} routed: assigned={} agent={}",
                        result.task().getId(), result.isAssigned(), result.routing().agentId()))
                .doFinally(signal -> {
                    ack.acknowledge();
                    structuredLogger.clearContext();
                })
                .subscribe(null, e -> {
                    tasksRejected.increment();
                    log.error("Failed to submit task from offset {}: {}", record.offset(), e.getMessage());
                });
    }
}
