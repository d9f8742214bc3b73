package com.z254.hivemind.dispatch.service;

import com.z254.hivemind.dispatch.learning.SkillGap;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Where the agent pool is thin, overloaded or idle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DistributionReport {

    private Instant timestamp;

    @Builder.Default
    private List<SkillGap> skillGaps = new ArrayList<>();

    @Builder.Default
    private List<String> overloadedAgents = new ArrayList<>();

    @Builder.Default
    private List<String> underutilizedAgents = new ArrayList<>();

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();
}
