package com.z254.hivemind.dispatch.domain.model;

/**
 * Urgency of an architecture improvement. Declared from most to least urgent.
 */
public enum ImprovementPriority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public boolean isUrgent() {
        return this == CRITICAL || this == HIGH;
    }
}
