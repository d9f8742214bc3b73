package com.z254.hivemind.dispatch.learning.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Overall health derived from recent outcomes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemHealth {

    public static final String INSUFFICIENT_DATA = "insufficient_data";

    /**
     * {@code excellent}, {@code good}, {@code fair}, {@code poor} or {@code insufficient_data}.
     */
    private String status;
    private double score;
    private double successRate;
    private double averageCompletionMinutes;
    private int totalTasksAnalyzed;
}
