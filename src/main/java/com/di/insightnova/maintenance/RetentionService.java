package com.di.insightnova.maintenance;

import com.di.insightnova.alert.AlertStore;
import com.di.insightnova.config.PipelineProperties;
import com.di.insightnova.insight.InsightStore;
import com.di.insightnova.performance.PerformanceSampleStore;
import com.di.insightnova.pipeline.staging.StagingStore;
import com.di.insightnova.pipeline.task.TaskTracker;
import com.di.insightnova.recommendation.RecommendationStore;
import com.di.insightnova.recommendation.UserContextStore;
import com.di.insightnova.scaling.WorkloadSampleStore;
import com.di.insightnova.stream.StreamEventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hourly purge of rows past their retention or expiry. Staged items are only purged once
 * terminal, and take their task rows with them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetentionService {

    private final StagingStore stagingStore;
    private final TaskTracker taskTracker;
    private final StreamEventStore streamEventStore;
    private final InsightStore insightStore;
    private final AlertStore alertStore;
    private final RecommendationStore recommendationStore;
    private final UserContextStore userContextStore;
    private final WorkloadSampleStore workloadSampleStore;
    private final PerformanceSampleStore performanceSampleStore;
    private final PipelineProperties properties;
    private final Clock clock;

    /** @return rows removed per kind */
    public Map<String, Integer> purge() {
        Instant now = clock.instant();
        Map<String, Integer> removed = new LinkedHashMap<>();

        List<String> itemIds = stagingStore.deleteTerminalBefore(now.minus(retention().getStagedItems()));
        removed.put("stagedItems", itemIds.size());
        removed.put("tasks", itemIds.isEmpty() ? 0 : taskTracker.forget(itemIds));
        removed.put("streamEvents", streamEventStore.deleteFinishedBefore(now.minus(retention().getStreamEvents())));
        removed.put("insights", insightStore.deleteExpired(now));
        removed.put("alerts", alertStore.deleteTriggeredBefore(now.minus(retention().getAlerts())));
        removed.put("recommendations", recommendationStore.deleteExpired(now));
        removed.put("userContexts", userContextStore.deleteExpired(now));
        removed.put("workloadSamples", workloadSampleStore.deleteBefore(now.minus(retention().getWorkloadSamples())));
        removed.put("performanceSamples", performanceSampleStore.purgeBefore(now.minus(retention().getPerformanceSamples())));

        int total = removed.values().stream().mapToInt(Integer::intValue).sum();
        if (total > 0) {
            log.info("[MAINTENANCE] Purged {} row(s): {}", total, removed);
        } else {
            log.debug("[MAINTENANCE] Nothing to purge");
        }
        return removed;
    }

    private PipelineProperties.RetentionConfig retention() {
        return properties.getRetention();
    }
}
