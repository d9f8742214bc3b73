package com.z254.hivemind.dispatch.api.v1;

import com.z254.hivemind.dispatch.api.dto.ErrorResponse;
import com.z254.hivemind.dispatch.messaging.MessageDeliveryException;
import com.z254.hivemind.dispatch.registry.AgentNotFoundException;
import com.z254.hivemind.dispatch.registry.CapacityExceededException;
import com.z254.hivemind.dispatch.registry.UnknownCapabilityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain exceptions to {@link ErrorResponse} bodies.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    private final Clock clock;

    public ApiExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(AgentNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleAgentNotFound(AgentNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "AGENT_NOT_FOUND", e.getMessage(),
                Map.of("agentId", e.getAgentId()));
    }

    @ExceptionHandler(CapacityExceededException.class)
    public ResponseEntity<ErrorResponse> handleCapacityExceeded(CapacityExceededException e) {
        log.error("Capacity invariant violated: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "CAPACITY_EXCEEDED", e.getMessage(), Map.of(
                "agentId", e.getAgentId(),
                "currentLoad", e.getCurrentLoad(),
                "maxConcurrentTasks", e.getMaxConcurrentTasks()));
    }

    @ExceptionHandler(UnknownCapabilityException.class)
    public ResponseEntity<ErrorResponse> handleUnknownCapability(UnknownCapabilityException e) {
        return respond(HttpStatus.BAD_REQUEST, "UNKNOWN_CAPABILITY", e.getMessage(),
                Map.of("capability", e.getTag()));
    }

    @ExceptionHandler(MessageDeliveryException.class)
    public ResponseEntity<ErrorResponse> handleMessageDelivery(MessageDeliveryException e) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "MESSAGE_DELIVERY_FAILED", e.getMessage(),
                Map.of("recipient", e.getRecipient()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage(), null);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleWebExchangeBind(WebExchangeBindException e) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            fieldErrors.put(error.getField(), error.getDefaultMessage());
        }
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed",
                Map.of("fieldErrors", fieldErrors));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleServerWebInput(ServerWebInputException e) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getReason(), null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message,
                                                  Map<String, Object> details) {
        ErrorResponse error = ErrorResponse.builder()
                .code(code)
                .message(message)
                .timestamp(clock.instant())
                .details(details)
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
