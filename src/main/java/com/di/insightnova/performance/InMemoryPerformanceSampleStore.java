package com.di.insightnova.performance;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * In-memory sample log in recording order, bounded to {@code maxSamples}: once full, each new
 * sample evicts the oldest one. Retention still purges by age.
 */
@Slf4j
@Component
public class InMemoryPerformanceSampleStore implements PerformanceSampleStore {

    static final int DEFAULT_MAX_SAMPLES = 100_000;

    private final Deque<PerformanceSample> samples = new ArrayDeque<>();
    private final int maxSamples;
    private long evicted;

    public InMemoryPerformanceSampleStore() {
        this(DEFAULT_MAX_SAMPLES);
    }

    @Autowired
    public InMemoryPerformanceSampleStore(PerformanceProperties properties) {
        this(properties.getMaxInMemorySamples());
    }

    public InMemoryPerformanceSampleStore(int maxSamples) {
        if (maxSamples < 1) {
            throw new IllegalArgumentException("maxSamples must be positive: " + maxSamples);
        }
        this.maxSamples = maxSamples;
    }

    @Override
    public void record(PerformanceSample sample) {
        if (sample == null || sample.getComponent() == null || sample.getMetric() == null) return;
        synchronized (samples) {
            samples.addLast(sample);
            while (samples.size() > maxSamples) {
                samples.removeFirst();
                if (evicted++ % 10_000 == 0) {
                    log.warn("[PERF] Sample log full at {} entries, evicting oldest ({} so far)", maxSamples, evicted);
                }
            }
        }
    }

    @Override
    public List<PerformanceSample> findSince(Instant since) {
        synchronized (samples) {
            return samples.stream()
                    .filter(s -> !s.getRecordedAt().isBefore(since))
                    .collect(Collectors.toList());
        }
    }

    @Override
    public List<PerformanceSample> findSince(String component, String metric, Instant since) {
        synchronized (samples) {
            return samples.stream()
                    .filter(s -> component.equals(s.getComponent()) && metric.equals(s.getMetric()))
                    .filter(s -> !s.getRecordedAt().isBefore(since))
                    .collect(Collectors.toList());
        }
    }

    @Override
    public int purgeBefore(Instant cutoff) {
        synchronized (samples) {
            int before = samples.size();
            samples.removeIf(s -> s.getRecordedAt().isBefore(cutoff));
            return before - samples.size();
        }
    }

    public int size() {
        synchronized (samples) {
            return samples.size();
        }
    }
}
