package com.z254.hivemind.dispatch.api.v1;

import com.z254.hivemind.dispatch.api.dto.AgentRequest;
import com.z254.hivemind.dispatch.domain.model.Agent;
import com.z254.hivemind.dispatch.registry.CapabilityCatalog;
import com.z254.hivemind.dispatch.service.DispatchCoordinator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * REST controller for agent registration.
 */
@RestController
@RequestMapping("/api/v1/agents")
@Tag(name = "Agents", description = "Agent registry operations")
@Slf4j
public class AgentController {

    private final DispatchCoordinator coordinator;
    private final CapabilityCatalog catalog;

    public AgentController(DispatchCoordinator coordinator, CapabilityCatalog catalog) {
        this.coordinator = coordinator;
        this.catalog = catalog;
    }

    @PostMapping
    @Operation(summary = "Register agent",
               description = "Register an agent, or replace the capabilities of a registered one")
    @ApiResponse(responseCode = "201", description = "Agent registered")
    @ApiResponse(responseCode = "400", description = "Invalid request or unknown capability")
    @ApiResponse(responseCode = "409", description = "New capacity is below the current load")
    public Mono<ResponseEntity<Agent>> registerAgent(@Valid @RequestBody AgentRequest request) {
        log.info("Registering agent: {}", request.getId());
        return Mono.fromCallable(() -> coordinator.registerAgent(request.toAgent(catalog)))
                .map(agent -> ResponseEntity.status(HttpStatus.CREATED).body(agent));
    }

    @GetMapping
    @Operation(summary = "List agents", description = "List all registered agents")
    public Flux<Agent> listAgents() {
        return Flux.defer(() -> Flux.fromIterable(coordinator.listAgents()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get agent", description = "Get an agent with its capabilities, load and metrics")
    @ApiResponse(responseCode = "200", description = "Agent found")
    @ApiResponse(responseCode = "404", description = "Agent not found")
    public Mono<ResponseEntity<Agent>> getAgent(
            @Parameter(description = "Agent ID") @PathVariable String id) {
        return Mono.justOrEmpty(coordinator.getAgent(id))
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Deregister agent", description = "Remove an agent from the registry")
    @ApiResponse(responseCode = "204", description = "Agent removed")
    @ApiResponse(responseCode = "404", description = "Agent not found")
    public Mono<ResponseEntity<Void>> deregisterAgent(
            @Parameter(description = "Agent ID") @PathVariable String id) {
        log.info("Deregistering agent: {}", id);
        return Mono.fromCallable(() -> coordinator.deregisterAgent(id))
                .map(removed -> removed
                        ? ResponseEntity.noContent().<Void>build()
                        : ResponseEntity.notFound().<Void>build());
    }
}
