package com.z254.hivemind.dispatch.learning;

import com.z254.hivemind.dispatch.domain.model.Capability;

/**
 * A capability with too few agents or too little expertise behind it.
 */
public record SkillGap(Capability capability, int coverage, double bestProficiency, Reason reason) {

    public enum Reason {
        LOW_COVERAGE,
        LOW_EXPERTISE
    }
}
