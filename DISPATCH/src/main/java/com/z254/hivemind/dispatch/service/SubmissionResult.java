package com.z254.hivemind.dispatch.service;

import com.z254.hivemind.dispatch.domain.model.TaskRequest;
import com.z254.hivemind.dispatch.routing.RoutingResult;

/**
 * @param task    the task as routed, after priority adjustment
 * @param routing the routing decision
 */
public record SubmissionResult(TaskRequest task, RoutingResult routing) {

    public boolean isAssigned() {
        return routing.isAssigned();
    }
}
