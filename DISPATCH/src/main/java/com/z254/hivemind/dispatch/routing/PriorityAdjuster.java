package com.z254.hivemind.dispatch.routing;

import com.z254.hivemind.dispatch.config.DispatchProperties;
import com.z254.hivemind.dispatch.domain.model.TaskPriority;
import com.z254.hivemind.dispatch.domain.model.TaskRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Escalates task priority by age and deadline proximity. Never lowers it.
 */
@Component
@Slf4j
public class PriorityAdjuster {

    private final Clock clock;
    private final DispatchProperties.PriorityProperties config;

    public PriorityAdjuster(Clock clock, DispatchProperties properties) {
        this.clock = clock;
        this.config = properties.getPriority();
    }

    public TaskRequest adjust(TaskRequest task) {
        Instant now = clock.instant();
        TaskPriority priority = task.getPriority();

        if (task.getCreatedAt() != null
                && Duration.between(task.getCreatedAt(), now).compareTo(config.getAgeEscalationThreshold()) > 0
                && priority != TaskPriority.CRITICAL) {
            priority = priority.escalate();
        }

        if (task.getDeadline() != null) {
            Duration remaining = Duration.between(now, task.getDeadline());
            if (remaining.compareTo(config.getDeadlineCriticalThreshold()) < 0) {
                priority = TaskPriority.CRITICAL;
            } else if (remaining.compareTo(config.getDeadlineHighThreshold()) < 0) {
                priority = priority.atLeast(TaskPriority.HIGH);
            }
        }

        TaskRequest adjusted = task.withPriority(priority);
        if (adjusted != task) {
            log.debug("Escalated task {} from {} to {}", task.getId(), task.getPriority(), adjusted.getPriority());
        }
        return adjusted;
    }
}
