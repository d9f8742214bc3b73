package com.z254.hivemind.dispatch.learning;

import com.z254.hivemind.dispatch.config.DispatchProperties;
import com.z254.hivemind.dispatch.domain.model.Capability;
import com.z254.hivemind.dispatch.domain.model.FailureCategory;
import com.z254.hivemind.dispatch.domain.model.TaskOutcome;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Set;

/**
 * Assigns a category to a failed outcome.
 * <p>
 * A category supplied by the caller wins. Otherwise the checks run in order: skill
 * mismatch, overload, timeout. Anything else is a quality issue; that bucket has no
 * positive signal of its own.
 */
@Component
public class FailureClassifier {

    private final Duration timeoutThreshold;

    public FailureClassifier(DispatchProperties properties) {
        this.timeoutThreshold = properties.getLearning().getTimeoutThreshold();
    }

    /**
     * @param outcome           the failed outcome
     * @param agentCapabilities capabilities the agent declares, or null if the agent is gone
     */
    public FailureCategory classify(TaskOutcome outcome, Set<Capability> agentCapabilities) {
        if (outcome.getContext() != null && outcome.getContext().getFailureCategory() != null) {
            return outcome.getContext().getFailureCategory();
        }

        Set<Capability> required = outcome.getContext() == null
                ? Set.of()
                : outcome.getContext().getRequiredCapabilities();
        if (agentCapabilities != null && !agentCapabilities.containsAll(required)) {
            return FailureCategory.SKILL_MISMATCH;
        }

        if (outcome.getAgentCapacity() > 0 && outcome.getAgentLoad() >= outcome.getAgentCapacity()) {
            return FailureCategory.OVERLOAD;
        }

        if (outcome.getCompletionTime() != null && outcome.getCompletionTime().compareTo(timeoutThreshold) > 0) {
            return FailureCategory.TIMEOUT;
        }

        return FailureCategory.QUALITY_ISSUE;
    }
}
