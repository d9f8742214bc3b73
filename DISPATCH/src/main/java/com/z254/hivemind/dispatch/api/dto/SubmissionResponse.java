package com.z254.hivemind.dispatch.api.dto;

import com.z254.hivemind.dispatch.domain.model.TaskPriority;
import com.z254.hivemind.dispatch.routing.RoutingResult;
import com.z254.hivemind.dispatch.service.SubmissionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a task submission.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionResponse {

    private String taskId;
    private boolean assigned;
    private String agentId;
    private TaskPriority priority;
    private RoutingResult.Reason reason;
    private double score;
    private int candidates;

    public static SubmissionResponse from(SubmissionResult result) {
        RoutingResult routing = result.routing();
        return SubmissionResponse.builder()
                .taskId(result.task().getId())
                .assigned(routing.isAssigned())
                .agentId(routing.agentId())
                .priority(result.task().getPriority())
                .reason(routing.reason())
                .score(routing.score())
                .candidates(routing.candidates().size())
                .build();
    }
}
