package com.z254.hivemind.dispatch.learning;

import com.z254.hivemind.dispatch.domain.model.Agent;
import com.z254.hivemind.dispatch.domain.model.Capability;
import com.z254.hivemind.dispatch.domain.model.FailurePattern;
import com.z254.hivemind.dispatch.domain.model.TaskPattern;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Statistics over the agent pool shared by the improvement rules and the distribution
 * report.
 */
public final class DistributionAnalysis {

    private DistributionAnalysis() {
    }

    /**
     * Capabilities in demand: every declared capability plus every capability seen in a
     * learned pattern.
     */
    public static TreeSet<Capability> demandedCapabilities(List<Agent> agents,
                                                           List<TaskPattern> taskPatterns,
                                                           List<FailurePattern> failurePatterns) {
        TreeSet<Capability> demanded = new TreeSet<>();
        for (Agent agent : agents) {
            demanded.addAll(agent.getCapabilities().keySet());
        }
        for (TaskPattern pattern : taskPatterns) {
            Object tags = pattern.getConditions().get("requiredCapabilities");
            if (tags instanceof Collection<?> collection) {
                for (Object tag : collection) {
                    demanded.add(Capability.of(String.valueOf(tag)));
                }
            }
        }
        for (FailurePattern pattern : failurePatterns) {
            demanded.addAll(pattern.getAffectedCapabilities());
        }
        return demanded;
    }

    /**
     * Gaps ordered by capability. A capability with low coverage is reported for that
     * reason only.
     */
    public static List<SkillGap> skillGaps(List<Agent> agents, Collection<Capability> demanded,
                                           int minCoverage, double minBestProficiency) {
        List<SkillGap> gaps = new ArrayList<>();
        for (Capability capability : new TreeSet<>(demanded)) {
            int coverage = 0;
            double best = 0.0;
            for (Agent agent : agents) {
                if (agent.getCapabilities().containsKey(capability)) {
                    coverage++;
                    best = Math.max(best, agent.proficiency(capability));
                }
            }
            if (coverage < minCoverage) {
                gaps.add(new SkillGap(capability, coverage, best, SkillGap.Reason.LOW_COVERAGE));
            } else if (best < minBestProficiency) {
                gaps.add(new SkillGap(capability, coverage, best, SkillGap.Reason.LOW_EXPERTISE));
            }
        }
        return gaps;
    }

    /**
     * Utilization per agent in percent, keyed and ordered by agent id.
     */
    public static Map<String, Double> utilizationPercent(List<Agent> agents) {
        Map<String, Double> result = new TreeMap<>();
        for (Agent agent : agents) {
            result.put(agent.getId(), agent.getUtilization() * 100.0);
        }
        return result;
    }

    public static double mean(Collection<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    /**
     * Sample variance (n - 1 denominator); 0 for fewer than two values.
     */
    public static double variance(Collection<Double> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double squares = 0.0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return squares / (values.size() - 1);
    }
}
