package com.z254.hivemind.dispatch.domain.model;

/**
 * Priority of a task. Declaration order is significance order.
 */
public enum TaskPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * The next level up, or CRITICAL if already there.
     */
    public TaskPriority escalate() {
        return this == CRITICAL ? CRITICAL : values()[ordinal() + 1];
    }

    /**
     * The higher of this priority and the given floor.
     */
    public TaskPriority atLeast(TaskPriority floor) {
        return floor != null && floor.ordinal() > ordinal() ? floor : this;
    }

    public boolean isBelow(TaskPriority other) {
        return ordinal() < other.ordinal();
    }
}
