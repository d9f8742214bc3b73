package com.z254.hivemind.dispatch.service;

import com.z254.hivemind.dispatch.config.DispatchProperties;
import com.z254.hivemind.dispatch.domain.model.ArchitectureImprovement;
import com.z254.hivemind.dispatch.learning.SweepResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodic pattern decay and improvement generation.
 */
@Component
@Slf4j
public class MaintenanceScheduler {

    private final DispatchCoordinator coordinator;
    private final DispatchProperties properties;

    public MaintenanceScheduler(DispatchCoordinator coordinator, DispatchProperties properties) {
        this.coordinator = coordinator;
        this.properties = properties;
    }

    @Scheduled(fixedRateString = "${dispatch.learning.sweep-interval:PT1H}",
            initialDelayString = "${dispatch.learning.sweep-interval:PT1H}")
    public void sweepPatterns() {
        log.debug("Starting scheduled pattern sweep");
        try {
            SweepResult result = coordinator.sweepPatterns();
            log.info("Pattern sweep complete: {} decayed, {} pruned, {} remaining",
                    result.decayed(), result.pruned(), result.remaining());
        } catch (RuntimeException e) {
            log.error("Pattern sweep failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedRateString = "${dispatch.improvements.schedule:PT6H}",
            initialDelayString = "${dispatch.improvements.schedule:PT6H}")
    public void generateImprovements() {
        if (!properties.getImprovements().isScheduledEnabled()) {
            return;
        }
        try {
            List<ArchitectureImprovement> improvements = coordinator.generateImprovements();
            log.info("Scheduled improvement run produced {} improvements", improvements.size());
        } catch (RuntimeException e) {
            log.error("Scheduled improvement run failed: {}", e.getMessage(), e);
        }
    }
}
