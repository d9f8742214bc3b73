package com.z254.hivemind.dispatch.api.dto;

import com.z254.hivemind.dispatch.domain.model.AgentMessage;
import com.z254.hivemind.dispatch.domain.model.MessageType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageRequest {

    @NotBlank(message = "Sender is required")
    private String from;

    @NotBlank(message = "Recipient is required")
    private String to;

    @NotNull(message = "Message type is required")
    private MessageType type;

    private Map<String, Object> content;

    public AgentMessage toMessage() {
        return AgentMessage.builder()
                .from(from)
                .to(to)
                .type(type)
                .content(content != null ? content : new HashMap<>())
                .build();
    }
}
