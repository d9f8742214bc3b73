package com.z254.hivemind.dispatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the DISPATCH service.
 */
@Data
@Component
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {

    private RoutingProperties routing = new RoutingProperties();
    private PriorityProperties priority = new PriorityProperties();
    private MessagingProperties messaging = new MessagingProperties();
    private LearningProperties learning = new LearningProperties();
    private ImprovementProperties improvements = new ImprovementProperties();
    private CapabilityProperties capabilities = new CapabilityProperties();
    private PersistenceProperties persistence = new PersistenceProperties();
    private KafkaProperties kafka = new KafkaProperties();

    /**
     * Load penalty: {@code loadPenaltyFactor * u} up to the saturation threshold, then
     * {@code saturationPenaltyFactor} per unit of utilization beyond it.
     */
    @Data
    public static class RoutingProperties {
        private double loadPenaltyFactor = 0.2;
        private double saturationThreshold = 0.8;
        private double saturationPenaltyFactor = 2.0;
    }

    @Data
    public static class PriorityProperties {
        private Duration ageEscalationThreshold = Duration.ofHours(24);
        private Duration deadlineHighThreshold = Duration.ofHours(1);
        private Duration deadlineCriticalThreshold = Duration.ofMinutes(15);
    }

    @Data
    public static class MessagingProperties {
        /**
         * {@code in-memory} or {@code redis}.
         */
        private String backend = "in-memory";
        private String keyPrefix = "dispatch:inbox:";
        private String processedSuffix = ":processed";
        private String channelPrefix = "dispatch:channel:";
        private String emergencyChannel = "dispatch:emergency";
        private int maxProcessedRetained = 1000;
        private int durableWriteRetries = 3;
        private Duration durableWriteBackoff = Duration.ofMillis(200);
        private Duration broadcastTimeout = Duration.ofSeconds(2);
        private String dispatcherId = "dispatcher";
    }

    @Data
    public static class LearningProperties {
        private Duration timeoutThreshold = Duration.ofHours(4);
        private int maxExamples = 10;
        private int confidenceSamples = 10;
        private int failureImpactSamples = 20;
        private Duration decayAfter = Duration.ofDays(30);
        private double decayFactor = 0.9;
        private double pruneConfidenceBelow = 0.1;
        private int pruneSampleSizeBelow = 3;
        private int performanceHistorySize = 1000;
        private int failureHistorySize = 500;
        private Duration sweepInterval = Duration.ofHours(1);
    }

    @Data
    public static class ImprovementProperties {
        private int minCapabilityCoverage = 2;
        private double minBestProficiency = 0.7;
        /**
         * Threshold on the variance of utilization percentages (percent squared).
         */
        private double utilizationVarianceThreshold = 400.0;
        private double lowUtilizationPercent = 30.0;
        private int dominantFailureMinFrequency = 5;
        private int trendWindow = 20;
        private int trendMinSamples = 10;
        private double trendDegradationRatio = 1.2;
        private Duration schedule = Duration.ofHours(6);
        private boolean scheduledEnabled = true;
    }

    @Data
    public static class CapabilityProperties {
        /**
         * Tags accepted in addition to the built-in catalog.
         */
        private List<String> additional = new ArrayList<>();
    }

    @Data
    public static class PersistenceProperties {
        /**
         * {@code in-memory} or {@code redis}.
         */
        private String backend = "in-memory";
        private String keyPrefix = "dispatch:state:";
    }

    @Data
    public static class KafkaProperties {
        private boolean enabled = false;
        private String consumerGroup = "dispatch";
        private TopicProperties topics = new TopicProperties();

        @Data
        public static class TopicProperties {
            private String tasks = "dispatch.tasks";
            private String outcomes = "dispatch.outcomes";
            private String assignments = "dispatch.assignments";
            private String improvements = "dispatch.improvements";
        }
    }
}
