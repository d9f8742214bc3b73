package com.z254.hivemind.dispatch.domain.model;

/**
 * Discriminator for learned task patterns.
 */
public enum PatternType {
    /** Keyed by (agent, task type). */
    SUCCESS,
    FAILURE,
    /** Keyed by the required capability set. */
    SKILL,
    TIMING,
    LOAD
}
