package com.di.insightnova.ai.gateway;

import com.di.insightnova.performance.PerformanceSample;
import com.di.insightnova.performance.PerformanceSampleStore;
import com.di.insightnova.util.MetricsCollector;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Decorates the active gateway with call accounting: Micrometer timer and counters, the rolling
 * activity read by the workload monitor, and an {@code inference_gateway/latency_ms} performance
 * sample per call (the input of the latency baseline).
 */
public class MeteredInferenceGateway implements InferenceGateway {

    public static final String COMPONENT = "inference_gateway";
    public static final String LATENCY_METRIC = "latency_ms";

    private final InferenceGateway delegate;
    private final MetricsCollector metricsCollector;
    private final GatewayActivityTracker activityTracker;
    private final PerformanceSampleStore sampleStore;
    private final Clock clock;

    public MeteredInferenceGateway(InferenceGateway delegate, MetricsCollector metricsCollector,
                                   GatewayActivityTracker activityTracker, PerformanceSampleStore sampleStore,
                                   Clock clock) {
        this.delegate = delegate;
        this.metricsCollector = metricsCollector;
        this.activityTracker = activityTracker;
        this.sampleStore = sampleStore;
        this.clock = clock;
    }

    @Override
    public String generate(String prompt) {
        return timed("generate", () -> delegate.generate(prompt));
    }

    @Override
    public boolean generateBool(String prompt) {
        return timed("generate_bool", () -> delegate.generateBool(prompt));
    }

    @Override
    public double generateDouble(String prompt) {
        return timed("generate_double", () -> delegate.generateDouble(prompt));
    }

    @Override
    public float[] generateEmbedding(String text) {
        return timed("generate_embedding", () -> delegate.generateEmbedding(text));
    }

    @Override
    public List<ForecastPoint> forecast(List<SeriesPoint> series, int horizon, double confidence) {
        return timed("forecast", () -> delegate.forecast(series, horizon, confidence));
    }

    private <T> T timed(String operation, Supplier<T> call) {
        long start = System.nanoTime();
        boolean success = false;
        try {
            T result = call.get();
            success = true;
            return result;
        } finally {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            Instant now = clock.instant();
            metricsCollector.recordGatewayCall(operation, durationMs, success);
            activityTracker.record(now, durationMs);
            if (success) {
                sampleStore.record(PerformanceSample.builder()
                        .component(COMPONENT)
                        .metric(LATENCY_METRIC)
                        .value(durationMs)
                        .recordedAt(now)
                        .build());
            }
        }
    }
}
