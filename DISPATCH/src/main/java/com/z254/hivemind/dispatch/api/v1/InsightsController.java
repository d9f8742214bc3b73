package com.z254.hivemind.dispatch.api.v1;

import com.z254.hivemind.dispatch.domain.model.ArchitectureImprovement;
import com.z254.hivemind.dispatch.learning.report.FailureAnalysisReport;
import com.z254.hivemind.dispatch.learning.report.LearningInsights;
import com.z254.hivemind.dispatch.learning.report.SuccessPatternReport;
import com.z254.hivemind.dispatch.service.DispatchCoordinator;
import com.z254.hivemind.dispatch.service.DistributionReport;
import com.z254.hivemind.dispatch.service.WorkloadReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST controller for workload, learning and improvement reports.
 */
@RestController
@RequestMapping("/api/v1/insights")
@Tag(name = "Insights", description = "Workload, learning and improvement reports")
@Slf4j
public class InsightsController {

    private final DispatchCoordinator coordinator;

    public InsightsController(DispatchCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @GetMapping("/workload")
    @Operation(summary = "Workload report", description = "Utilization and availability per agent")
    public Mono<WorkloadReport> workload() {
        return Mono.fromCallable(coordinator::workloadReport);
    }

    @GetMapping("/learning")
    @Operation(summary = "Learning insights", description = "System health and what has been learned so far")
    public Mono<LearningInsights> learning() {
        return Mono.fromCallable(coordinator::learningInsights);
    }

    @PostMapping("/improvements")
    @Operation(summary = "Generate improvements",
               description = "Run the improvement rules now. The result replaces the previous run.")
    public Mono<List<ArchitectureImprovement>> generateImprovements() {
        log.info("Generating improvements on request");
        return Mono.fromCallable(coordinator::generateImprovements);
    }

    @GetMapping("/improvements")
    @Operation(summary = "Latest improvements", description = "Improvements from the most recent run")
    public Mono<List<ArchitectureImprovement>> latestImprovements() {
        return Mono.fromCallable(coordinator::latestImprovements);
    }

    @GetMapping("/patterns/success")
    @Operation(summary = "Success patterns", description = "High-confidence success patterns by capability set and agent")
    public Mono<SuccessPatternReport> successPatterns() {
        return Mono.fromCallable(coordinator::successPatternReport);
    }

    @GetMapping("/patterns/failures")
    @Operation(summary = "Failure analysis", description = "Failure breakdown by category with critical issues")
    public Mono<FailureAnalysisReport> failurePatterns() {
        return Mono.fromCallable(coordinator::failureAnalysisReport);
    }

    @GetMapping("/distribution")
    @Operation(summary = "Distribution analysis", description = "Skill gaps plus overloaded and idle agents")
    public Mono<DistributionReport> distribution() {
        return Mono.fromCallable(coordinator::optimizeDistribution);
    }
}
