package com.z254.hivemind.dispatch.kafka;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.hivemind.dispatch.api.dto.OutcomeRequest;
import com.z254.hivemind.dispatch.observability.DispatchStructuredLogger;
import com.z254.hivemind.dispatch.registry.CapabilityCatalog;
import com.z254.hivemind.dispatch.service.DispatchCoordinator;
import com.z254.hivemind.dispatch.service.OutcomeReceipt;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Consumes outcome reports from the outcomes topic. The payload is an outcome request with
 * an additional {@code taskId} field.
 */
@Component
@ConditionalOnProperty(prefix = "dispatch.kafka", name = "enabled", havingValue = "true")
@Slf4j
public class OutcomeReportConsumer {

    private final DispatchCoordinator coordinator;
    private final CapabilityCatalog catalog;
    private final ObjectMapper objectMapper;
    private final DispatchStructuredLogger structuredLogger;
    private final Counter outcomesConsumed;
    private final Counter outcomesRejected;

    public OutcomeReportConsumer(DispatchCoordinator coordinator,
                                 CapabilityCatalog catalog,
                                 ObjectMapper objectMapper,
                                 DispatchStructuredLogger structuredLogger,
                                 MeterRegistry meterRegistry) {
        this.coordinator = coordinator;
        this.catalog = catalog;
        this.objectMapper = objectMapper;
        this.structuredLogger = structuredLogger;
        this.outcomesConsumed = Counter.builder("dispatch.kafka.outcomes.consumed").register(meterRegistry);
        this.outcomesRejected = Counter.builder("dispatch.kafka.outcomes.rejected").register(meterRegistry);
    }

    @KafkaListener(
            topics = "${dispatch.kafka.topics.outcomes:dispatch.outcomes}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        outcomesConsumed.increment();
        try {
            JsonNode payload = objectMapper.readTree(record.value());
            String taskId = payload.path("taskId").asText(record.key());
            OutcomeRequest request = objectMapper.treeToValue(payload, OutcomeRequest.class);
            structuredLogger.setTaskContext(taskId, request.getAgentId(), record.key());

            OutcomeReceipt receipt = coordinator.reportOutcome(
                    request.getAgentId(),
                    taskId,
                    Boolean.TRUE.equals(request.getSuccess()),
                    request.getCompletionTime(),
                    request.toContext(catalog));
            log.info("Recorded outcome for task {} on agent {}: success={} category={}",
                    taskId, receipt.agentId(), receipt.success(), receipt.failureCategory());
        } catch (Exception e) {
            outcomesRejected.increment();
            log.error("Failed to record outcome from offset {}: {}", record.offset(), e.getMessage());
        } finally {
            ack.acknowledge();
            structuredLogger.clearContext();
        }
    }
}
