package com.z254.hivemind.dispatch.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.hivemind.dispatch.domain.model.FailureCategory;
import com.z254.hivemind.dispatch.domain.model.TaskPriority;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Machine-parseable dispatch events, one JSON object per log line.
 */
@Component
@Slf4j
public class DispatchStructuredLogger {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_TASK_ID = "taskId";
    public static final String MDC_AGENT_ID = "agentId";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DispatchStructuredLogger(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void setTaskContext(String taskId, String agentId, String correlationId) {
        if (taskId != null) MDC.put(MDC_TASK_ID, taskId);
        if (agentId != null) MDC.put(MDC_AGENT_ID, agentId);
        if (correlationId != null) MDC.put(MDC_CORRELATION_ID, correlationId);
    }

    public void clearContext() {
        MDC.remove(MDC_TASK_ID);
        MDC.remove(MDC_AGENT_ID);
        MDC.remove(MDC_CORRELATION_ID);
    }

    public void logTaskRouted(String taskId, String agentId, TaskPriority priority, double score) {
        logEvent("task_routed", Map.of(
                "taskId", taskId,
                "agentId", agentId,
                "priority", priority.name(),
                "score", score
        ));
    }

    public void logTaskUnroutable(String taskId, String reason, int candidates) {
        logEvent("task_unroutable", Map.of(
                "taskId", taskId,
                "reason", reason,
                "candidates", candidates
        ));
    }

    public void logOutcomeRecorded(String taskId, String agentId, boolean success, long durationMs) {
        logEvent("outcome_recorded", Map.of(
                "taskId", taskId,
                "agentId", agentId,
                "success", success,
                "durationMs", durationMs
        ));
    }

    public void logFailureClassified(String taskId, String agentId, FailureCategory category) {
        logEvent("failure_classified", Map.of(
                "taskId", taskId,
                "agentId", agentId,
                "category", category.getCode()
        ));
    }

    public void logImprovementsGenerated(List<String> improvementIds) {
        Map<String, Object> data = new HashMap<>();
        data.put("count", improvementIds.size());
        data.put("improvementIds", improvementIds);
        logEvent("improvements_generated", data);
    }

    private void logEvent(String eventType, Map<String, Object> data) {
        Map<String, Object> event = new HashMap<>(data);
        event.put("event", eventType);
        event.put("timestamp", clock.instant().toString());
        event.put("service", "dispatch");

        String correlationId = MDC.get(MDC_CORRELATION_ID);
        if (correlationId != null) event.put("correlationId", correlationId);

        try {
            log.info(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.info("event={} data={}", eventType, data);
        }
    }
}
