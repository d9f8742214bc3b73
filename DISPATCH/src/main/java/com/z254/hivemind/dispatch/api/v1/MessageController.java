package com.z254.hivemind.dispatch.api.v1;

import com.z254.hivemind.dispatch.api.dto.EmergencyRequest;
import com.z254.hivemind.dispatch.api.dto.MessageRequest;
import com.z254.hivemind.dispatch.domain.model.AgentMessage;
import com.z254.hivemind.dispatch.service.DispatchCoordinator;
import com.z254.hivemind.dispatch.service.EmergencyBroadcastResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST controller for agent messaging.
 */
@RestController
@RequestMapping("/api/v1/messages")
@Tag(name = "Messages", description = "Durable and live agent messaging")
@Slf4j
public class MessageController {

    private final DispatchCoordinator coordinator;

    public MessageController(DispatchCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping
    @Operation(summary = "Send message", description = "Store a message durably and broadcast it to live listeners")
    @ApiResponse(responseCode = "202", description = "Message stored")
    @ApiResponse(responseCode = "503", description = "Message could not be stored durably")
    public Mono<ResponseEntity<AgentMessage>> sendMessage(@Valid @RequestBody MessageRequest request) {
        return coordinator.sendMessage(request.toMessage())
                .map(message -> ResponseEntity.status(HttpStatus.ACCEPTED).body(message));
    }

    @GetMapping("/{recipient}")
    @Operation(summary = "Read messages",
               description = "Return and archive every pending message for a recipient. A second read returns only newer messages.")
    public Mono<List<AgentMessage>> readMessages(
            @Parameter(description = "Recipient agent ID") @PathVariable String recipient) {
        return coordinator.readMessages(recipient);
    }

    @GetMapping(value = "/{recipient}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Stream messages", description = "Live messages for a recipient as server-sent events")
    public Flux<ServerSentEvent<AgentMessage>> streamMessages(
            @Parameter(description = "Recipient agent ID") @PathVariable String recipient) {
        log.debug("Opening message stream for {}", recipient);
        return coordinator.listen(recipient)
                .map(message -> ServerSentEvent.<AgentMessage>builder()
                        .id(message.getId())
                        .event(message.getType().name().toLowerCase())
                        .data(message)
                        .build())
                .doFinally(signal -> log.debug("Closed message stream for {}: {}", recipient, signal));
    }

    @PostMapping("/emergency")
    @Operation(summary = "Emergency broadcast",
               description = "Alert every registered agent except the sender")
    @ApiResponse(responseCode = "202", description = "Alert delivered")
    public Mono<ResponseEntity<EmergencyBroadcastResult>> emergencyBroadcast(
            @Valid @RequestBody EmergencyRequest request) {
        return coordinator.emergencyBroadcast(request.getFrom(), request.getComponent(),
                        request.getStatus(), request.getActionRequest())
                .map(result -> ResponseEntity.status(HttpStatus.ACCEPTED).body(result));
    }
}
