package com.z254.hivemind.dispatch.domain.model;

public enum ImplementationEffort {
    LOW,
    MEDIUM,
    HIGH
}
