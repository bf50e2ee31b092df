package com.di.insightnova.scaling;

import com.di.insightnova.ai.gateway.ForecastPoint;
import com.di.insightnova.ai.gateway.GatewayActivityTracker;
import com.di.insightnova.ai.gateway.InferenceGateway;
import com.di.insightnova.ai.gateway.InferenceUnavailableException;
import com.di.insightnova.ai.gateway.SeriesPoint;
import com.di.insightnova.pipeline.staging.StagingStore;
import com.di.insightnova.pipeline.staging.ValidationStatus;
import com.di.insightnova.pipeline.task.TaskStatus;
import com.di.insightnova.pipeline.task.TaskTracker;
import com.di.insightnova.stream.StreamEventStatus;
import com.di.insightnova.stream.StreamEventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Takes one workload sample per scaling cycle and attaches a load forecast from the inference
 * gateway. A failed forecast is not an error: the sample is stored with
 * {@code forecastAvailable=false} and the controller falls back to current load.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkloadMonitor {

    private final StagingStore stagingStore;
    private final StreamEventStore streamEventStore;
    private final TaskTracker taskTracker;
    private final GatewayActivityTracker activityTracker;
    private final InferenceGateway gateway;
    private final WorkloadSampleStore sampleStore;
    private final ScalingProperties properties;
    private final Clock clock;

    public WorkloadSample sample() {
        Instant now = clock.instant();
        long backlog = stagingStore.countByStatus(ValidationStatus.PENDING)
                + streamEventStore.countByStatus(StreamEventStatus.PENDING);
        long active = taskTracker.counts().getOrDefault(TaskStatus.PROCESSING, 0L);
        GatewayActivityTracker.Snapshot activity = activityTracker.snapshot(now, properties.getGatewayWindow());
        double load = systemLoad(backlog, properties.getBacklogCapacity());

        WorkloadSample.WorkloadSampleBuilder builder = WorkloadSample.builder()
                .id(UUID.randomUUID().toString())
                .sampledAt(now)
                .pendingItems(backlog)
                .activeTasks(active)
                .gatewayCallsPerMinute(activity.callsPerMinute())
                .averageGatewayLatencyMs(activity.averageLatencyMs())
                .systemLoadPct(load)
                .forecastAvailable(false);

        List<SeriesPoint> series = loadSeries(now, load);
        try {
            List<ForecastPoint> forecast = gateway.forecast(series, properties.getForecastHorizon(),
                    properties.getForecastConfidence());
            if (!forecast.isEmpty()) {
                ForecastPoint next = forecast.get(0);
                builder.predictedLoad(clampLoad(next.value()))
                        .forecastLower(clampLoad(next.lower()))
                        .forecastUpper(clampLoad(next.upper()))
                        .forecastAvailable(true);
            }
        } catch (InferenceUnavailableException e) {
            log.warn("[SCALING] Load forecast unavailable, sampling current load only: {}", e.getMessage());
        }

        WorkloadSample sample = builder.build();
        sampleStore.save(sample);
        log.info("[SCALING] Workload sample: backlog={}, activeTasks={}, load={}%, forecast={}",
                backlog, active, Math.round(load), sample.isForecastAvailable() ? Math.round(sample.getPredictedLoad()) : "n/a");
        return sample;
    }

    /** Recent load values oldest first, ending with the value just measured. */
    private List<SeriesPoint> loadSeries(Instant now, double currentLoad) {
        List<WorkloadSample> recent = new ArrayList<>(sampleStore.findRecent(properties.getForecastSeriesPoints() - 1));
        Collections.reverse(recent);
        List<SeriesPoint> series = new ArrayList<>(recent.size() + 1);
        for (WorkloadSample s : recent) {
            series.add(new SeriesPoint(s.getSampledAt(), s.getSystemLoadPct()));
        }
        series.add(new SeriesPoint(now, currentLoad));
        return series;
    }

    static double systemLoad(long backlog, long capacity) {
        if (capacity <= 0) return 100.0;
        return Math.min(100.0, backlog * 100.0 / capacity);
    }

    private static double clampLoad(double v) {
        return Math.max(0.0, Math.min(100.0, v));
    }
}
