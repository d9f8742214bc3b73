package com.z254.hivemind.dispatch.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmergencyRequest {

    @NotBlank(message = "Sender is required")
    private String from;

    @NotBlank(message = "Component is required")
    private String component;

    @NotBlank(message = "Status is required")
    private String status;

    /**
     * Defaults to {@code STOP_ALL_WORK}.
     */
    private String actionRequest;
}
