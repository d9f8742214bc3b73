package com.z254.hivemind.dispatch.learning.rule;

import com.z254.hivemind.dispatch.domain.model.ArchitectureImprovement;
import com.z254.hivemind.dispatch.learning.AnalysisContext;

import java.util.Optional;

/**
 * One independent check of an improvement run. Fires at most once per run and must be
 * deterministic for a given context.
 */
public interface ImprovementRule {

    /**
     * Stable rule name, used in logs.
     */
    String getName();

    Optional<ArchitectureImprovement> evaluate(AnalysisContext context);
}
