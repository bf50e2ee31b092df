package com.di.insightnova.scaling;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code insightnova.scaling.*}: controller tuning and the policies seeded on first start.
 */
@Data
@ConfigurationProperties(prefix = "insightnova.scaling")
public class ScalingProperties {

    /** Expected gap between workload samples; samples older than twice this are stale. */
    private Duration samplingInterval = Duration.ofMinutes(5);
    /** Points added to the up threshold and removed from the down threshold when no usable forecast exists. */
    private double hysteresisMargin = 5.0;
    /** Scale-ups below this ROI are recorded as CONSIDER and not applied. */
    private double minRoi = 5.0;
    /** Backlog (pending staged items + pending stream events) that counts as 100 % load. */
    private long backlogCapacity = 1000;
    /** Past load points sent to the forecaster. */
    private int forecastSeriesPoints = 24;
    private int forecastHorizon = 1;
    private double forecastConfidence = 0.8;
    /** Window used for gateway calls/min and latency. */
    private Duration gatewayWindow = Duration.ofMinutes(5);

    private List<PolicySeed> defaults = new ArrayList<>(List.of(
            new PolicySeed(ResourceType.COMPUTE, 100, 2000, 100, 80, 30, 200, 100, Duration.ofMinutes(5), 0.01),
            new PolicySeed(ResourceType.MEMORY, 1000, 10000, 1000, 85, 40, 1000, 500, Duration.ofMinutes(10), 0.005),
            new PolicySeed(ResourceType.AI_QUOTA, 1000, 50000, 1000, 90, 50, 5000, 2000, Duration.ofMinutes(15), 0.001)));

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PolicySeed {
        private ResourceType resourceType;
        private int          minCapacity;
        private int          maxCapacity;
        private int          initialCapacity;
        private double       scaleUpThreshold;
        private double       scaleDownThreshold;
        private int          scaleUpIncrement;
        private int          scaleDownIncrement;
        private Duration     cooldown;
        private double       unitCost;

        public ScalingPolicy toPolicy() {
            return ScalingPolicy.builder()
                    .resourceType(resourceType)
                    .minCapacity(minCapacity)
                    .maxCapacity(maxCapacity)
                    .currentCapacity(initialCapacity)
                    .scaleUpThreshold(scaleUpThreshold)
                    .scaleDownThreshold(scaleDownThreshold)
                    .scaleUpIncrement(scaleUpIncrement)
                    .scaleDownIncrement(scaleDownIncrement)
                    .cooldown(cooldown)
                    .unitCost(unitCost)
                    .active(true)
                    .lastState(ScalingState.EVALUATING)
                    .build();
        }
    }
}
