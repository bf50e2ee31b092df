package com.di.insightnova.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Strongly-typed binding for {@code insightnova.pipeline.*}.
 *
 * <pre>
 * insightnova:
 *   pipeline:
 *     batch-size: 100
 *     tasks:
 *       max-attempts: 3
 *       timeout: 10m
 *     stream:
 *       history-window: 24h
 *     alerts:
 *       lookback: 15m
 *     recommendations:
 *       ttl: 4h
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "insightnova.pipeline")
public class PipelineProperties {

    /** Pending items claimed per pipeline cycle. */
    private int batchSize = 100;
    /** RETRYING / stale tasks of later stages resumed per stage per cycle. */
    private int resumeBatchSize = 50;
    /** Validation score an item must exceed (together with the schema verdict) to be VALID. */
    private double validityThreshold = 0.7;
    private List<String> requiredFields = new ArrayList<>(List.of("content", "timestamp", "source"));
    private List<String> enrichmentSources = new ArrayList<>(
            List.of("enterprise_knowledge_base", "user_interactions", "business_metrics"));

    @NestedConfigurationProperty
    private TaskConfig tasks = new TaskConfig();

    @NestedConfigurationProperty
    private StreamConfig stream = new StreamConfig();

    @NestedConfigurationProperty
    private AlertConfig alerts = new AlertConfig();

    @NestedConfigurationProperty
    private RecommendationConfig recommendations = new RecommendationConfig();

    @NestedConfigurationProperty
    private RetentionConfig retention = new RetentionConfig();

    // ------------------------------------------------------------------ //

    @Data
    public static class TaskConfig {
        private int      maxAttempts = 3;
        private Duration timeout     = Duration.ofMinutes(10);
    }

    @Data
    public static class StreamConfig {
        private int      batchSize              = 100;
        private Duration historyWindow          = Duration.ofHours(24);
        private int      historyLimit           = 5;
        private Duration insightTtl             = Duration.ofHours(24);
        private double   coldStartConfidenceCap = 0.5;
        private String   defaultTargetUsers     = "all_users";
    }

    @Data
    public static class AlertConfig {
        private Duration     lookback                   = Duration.ofMinutes(15);
        private double       minConfidence              = 0.6;
        private int          candidateLimit             = 50;
        private double       significanceThreshold      = 0.7;
        private double       anomalyConfidenceThreshold = 0.7;
        private int          anomalySeriesPoints        = 24;
        private int          dispatchBatchSize          = 50;
        /** Audience used when composing alert messages. */
        private String       defaultRole                = "business_analyst";
        private List<String> defaultProjects            = new ArrayList<>(List.of("operations"));
    }

    @Data
    public static class RecommendationConfig {
        private Duration ttl               = Duration.ofHours(4);
        private Duration activeUserWindow  = Duration.ofHours(2);
        private int      maxUsersPerCycle  = 20;
        private int      similarInsights   = 10;
        private Duration insightLookback   = Duration.ofDays(30);
        private Duration contextTtl        = Duration.ofDays(1);
        private int      defaultQueryLimit = 10;
    }

    @Data
    public static class RetentionConfig {
        private Duration stagedItems        = Duration.ofDays(7);
        private Duration streamEvents       = Duration.ofDays(7);
        private Duration alerts             = Duration.ofDays(30);
        private Duration workloadSamples    = Duration.ofDays(7);
        private Duration performanceSamples = Duration.ofDays(30);
    }
}
