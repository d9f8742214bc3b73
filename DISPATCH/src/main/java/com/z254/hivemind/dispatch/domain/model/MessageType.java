package com.z254.hivemind.dispatch.domain.model;

/**
 * Types of messages exchanged between the dispatcher and agents.
 */
public enum MessageType {
    TASK_ASSIGNMENT,
    STATUS_UPDATE,
    NOTIFICATION,
    KNOWLEDGE_SHARE,
    COORDINATION_REQUEST,
    EMERGENCY_ALERT
}
