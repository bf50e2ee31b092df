package com.di.insightnova.insight;

import com.di.insightnova.config.PipelineProperties;
import com.di.insightnova.pipeline.staging.StagingStore;
import com.di.insightnova.pipeline.staging.ValidationStatus;
import com.di.insightnova.pipeline.task.ProcessingStage;
import com.di.insightnova.pipeline.task.ProcessingTask;
import com.di.insightnova.pipeline.task.TaskStatus;
import com.di.insightnova.pipeline.task.TaskTracker;
import com.di.insightnova.stream.StreamEvent;
import com.di.insightnova.stream.StreamEventPublisher;
import com.di.insightnova.stream.StreamEventStatus;
import com.di.insightnova.stream.StreamEventStore;
import com.di.insightnova.util.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * The stream job body: claims published events through the ANALYSIS stage of their staged item,
 * generates insights and marks the event completed. Gateway failures follow the same bounded
 * retry as the pipeline; an event whose analysis fails permanently is marked FAILED. A task
 * whose event is gone is re-published from its staged item, or failed when the item is gone too.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StreamProcessor {

    static final String MISSING_EVENT_REASON = "stream event missing";

    private final StreamEventStore streamEventStore;
    private final StreamEventPublisher publisher;
    private final StagingStore stagingStore;
    private final InsightStore insightStore;
    private final StreamInsightGenerator generator;
    private final TaskTracker taskTracker;
    private final PipelineProperties properties;
    private final MetricsCollector metricsCollector;
    private final Clock clock;

    /**
     * @return number of insights written
     */
    public int processPendingStreams() {
        for (ProcessingTask expired : taskTracker.expireStale(ProcessingStage.ANALYSIS)) {
            streamEventStore.findByStagedItemId(expired.getItemId())
                    .ifPresent(e -> streamEventStore.updateStatus(e.getId(), StreamEventStatus.FAILED, clock.instant()));
        }

        int written = 0;
        for (String stagedItemId : taskTracker.findClaimable(ProcessingStage.ANALYSIS, config().getBatchSize())) {
            if (!taskTracker.claim(stagedItemId, ProcessingStage.ANALYSIS)) {
                continue;
            }
            Optional<StreamEvent> event = streamEventStore.findByStagedItemId(stagedItemId)
                    .or(() -> republish(stagedItemId));
            if (event.isEmpty()) {
                taskTracker.abandon(stagedItemId, ProcessingStage.ANALYSIS, MISSING_EVENT_REASON);
                continue;
            }
            written += analyse(event.get());
        }
        if (written > 0) {
            log.info("[STREAM] Generated {} insights", written);
        }
        return written;
    }

    /** Rebuilds the event of an analysis task whose event is gone, when its item is still valid. */
    private Optional<StreamEvent> republish(String stagedItemId) {
        Optional<StreamEvent> event = stagingStore.findById(stagedItemId)
                .filter(item -> item.getStatus() == ValidationStatus.VALID)
                .map(publisher::publish);
        if (event.isPresent()) {
            log.info("[STREAM] Re-published missing event for item {} as {}", stagedItemId, event.get().getId());
        } else {
            log.warn("[STREAM] No stream event and no valid staged item for {}", stagedItemId);
        }
        return event;
    }

    private int analyse(StreamEvent event) {
        streamEventStore.updateStatus(event.getId(), StreamEventStatus.PROCESSING, clock.instant());
        try {
            List<StreamInsight> insights = generator.process(event);
            insightStore.saveAll(insights);
            streamEventStore.updateStatus(event.getId(), StreamEventStatus.COMPLETED, clock.instant());
            taskTracker.complete(event.getStagedItemId(), ProcessingStage.ANALYSIS);
            insights.forEach(i -> metricsCollector.recordInsight(i.getConfidence()));
            return insights.size();
        } catch (RuntimeException e) {
            String reason = e.getClass().getSimpleName() + ": " + e.getMessage();
            TaskStatus status = taskTracker.fail(event.getStagedItemId(), ProcessingStage.ANALYSIS, reason);
            if (status == TaskStatus.FAILED) {
                streamEventStore.updateStatus(event.getId(), StreamEventStatus.FAILED, clock.instant());
                log.error("[STREAM] Event {} failed permanently: {}", event.getId(), reason);
            } else {
                streamEventStore.updateStatus(event.getId(), StreamEventStatus.PENDING, clock.instant());
                log.warn("[STREAM] Event {} analysis failed, will retry: {}", event.getId(), reason);
            }
            return 0;
        }
    }

    private PipelineProperties.StreamConfig config() {
        return properties.getStream();
    }
}
