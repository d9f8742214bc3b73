package com.z254.hivemind.dispatch.api.v1;

import com.z254.hivemind.dispatch.api.dto.OutcomeRequest;
import com.z254.hivemind.dispatch.api.dto.SubmissionResponse;
import com.z254.hivemind.dispatch.api.dto.TaskSubmissionRequest;
import com.z254.hivemind.dispatch.domain.model.TaskRequest;
import com.z254.hivemind.dispatch.registry.CapabilityCatalog;
import com.z254.hivemind.dispatch.service.DispatchCoordinator;
import com.z254.hivemind.dispatch.service.OutcomeReceipt;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for task submission and outcome reporting.
 */
@RestController
@RequestMapping("/api/v1/tasks")
@Tag(name = "Tasks", description = "Task routing and outcome operations")
@Slf4j
public class TaskController {

    private final DispatchCoordinator coordinator;
    private final CapabilityCatalog catalog;

    public TaskController(DispatchCoordinator coordinator, CapabilityCatalog catalog) {
        this.coordinator = coordinator;
        this.catalog = catalog;
    }

    @PostMapping
    @Operation(summary = "Submit task",
               description = "Route a task to the best available agent. An unassigned response is not an error.")
    @ApiResponse(responseCode = "200", description = "Routing decision")
    @ApiResponse(responseCode = "400", description = "Invalid request or unknown capability")
    @ApiResponse(responseCode = "503", description = "Assignment message could not be stored")
    public Mono<ResponseEntity<SubmissionResponse>> submitTask(@Valid @RequestBody TaskSubmissionRequest request) {
        return Mono.fromCallable(() -> request.toTask(catalog))
                .flatMap(coordinator::submit)
                .map(SubmissionResponse::from)
                .map(ResponseEntity::ok)
                .doOnSuccess(r -> log.info("Submitted task {}: assigned={} agent={}",
                        r.getBody().getTaskId(), r.getBody().isAssigned(), r.getBody().getAgentId()));
    }

    @PostMapping("/batch")
    @Operation(summary = "Submit batch", description = "Route tasks in order, one after another")
    @ApiResponse(responseCode = "200", description = "Routing decisions in submission order")
    public Flux<SubmissionResponse> submitBatch(@Valid @RequestBody List<TaskSubmissionRequest> requests) {
        return Mono.fromCallable(() -> requests.stream()
                        .map(request -> request.toTask(catalog))
                        .collect(Collectors.toList()))
                .flatMapMany(coordinator::submitBatch)
                .map(SubmissionResponse::from);
    }

    @PostMapping("/{taskId}/outcome")
    @Operation(summary = "Report outcome",
               description = "Record success or failure of a task and release the agent's slot")
    @ApiResponse(responseCode = "200", description = "Outcome recorded")
    @ApiResponse(responseCode = "404", description = "Agent not found")
    public Mono<ResponseEntity<OutcomeReceipt>> reportOutcome(
            @Parameter(description = "Task ID") @PathVariable String taskId,
            @Valid @RequestBody OutcomeRequest request) {
        return Mono.fromCallable(() -> coordinator.reportOutcome(
                        request.getAgentId(),
                        taskId,
                        request.getSuccess(),
                        request.getCompletionTime(),
                        request.toContext(catalog)))
                .map(ResponseEntity::ok);
    }

    @PostMapping("/priority")
    @Operation(summary = "Preview priority",
               description = "Show the priority a task would be routed with, without routing it")
    public Mono<ResponseEntity<TaskRequest>> previewPriority(@Valid @RequestBody TaskSubmissionRequest request) {
        return Mono.fromCallable(() -> coordinator.previewPriority(request.toTask(catalog)))
                .map(ResponseEntity::ok);
    }
}
