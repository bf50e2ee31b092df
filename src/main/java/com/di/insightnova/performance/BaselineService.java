package com.di.insightnova.performance;

import com.di.insightnova.util.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Maintains per-(component, metric) baselines from recorded samples and flags values that exceed
 * the upper band.
 *
 * <p>Severity is judged against the baseline mean: above 2× is SEVERE, above 1.5× MODERATE,
 * otherwise MINOR. Without a baseline nothing is ever detected.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BaselineService {

    private final PerformanceSampleStore sampleStore;
    private final BaselineStore baselineStore;
    private final PerformanceProperties properties;
    private final MetricsCollector metricsCollector;
    private final Clock clock;

    private final Map<String, RegressionFinding> latestFindings = new ConcurrentHashMap<>();

    /**
     * Recomputes every baseline from the trailing window and replaces the stored set.
     *
     * @return number of baselines written
     */
    public int refreshBaselines() {
        Instant now = clock.instant();
        Instant since = now.minus(Duration.ofDays(properties.getWindowDays()));
        Map<String, List<PerformanceSample>> grouped = sampleStore.findSince(since).stream()
                .collect(Collectors.groupingBy(s -> s.getComponent() + "/" + s.getMetric(),
                        LinkedHashMap::new, Collectors.toList()));

        List<PerformanceBaseline> baselines = new ArrayList<>();
        for (List<PerformanceSample> group : grouped.values()) {
            double[] values = group.stream().mapToDouble(PerformanceSample::getValue).sorted().toArray();
            PerformanceSample first = group.get(0);
            baselines.add(PerformanceBaseline.builder()
                    .component(first.getComponent())
                    .metric(first.getMetric())
                    .mean(mean(values))
                    .lowerBand(percentile(values, properties.getLowerPercentile()))
                    .upperBand(percentile(values, properties.getUpperPercentile()))
                    .windowDays(properties.getWindowDays())
                    .sampleCount(values.length)
                    .updatedAt(now)
                    .build());
        }
        baselineStore.replaceAll(baselines);
        log.info("[BASELINE] Refreshed {} baselines from the last {} days", baselines.size(), properties.getWindowDays());
        return baselines.size();
    }

    public RegressionResult detectRegression(String component, String metric, double value) {
        Optional<PerformanceBaseline> found = baselineStore.find(component, metric);
        if (found.isEmpty()) {
            return RegressionResult.builder()
                    .component(component)
                    .metric(metric)
                    .value(value)
                    .detected(false)
                    .severity(RegressionSeverity.NONE)
                    .recommendation(RegressionSeverity.NONE.getRecommendation())
                    .build();
        }
        PerformanceBaseline baseline = found.get();
        boolean detected = value > baseline.getUpperBand();
        RegressionSeverity severity = detected ? severityOf(value, baseline.getMean()) : RegressionSeverity.NONE;
        double degradation = baseline.getMean() > 0 ? (value - baseline.getMean()) / baseline.getMean() * 100.0 : 0.0;
        return RegressionResult.builder()
                .component(component)
                .metric(metric)
                .value(value)
                .detected(detected)
                .severity(severity)
                .baseline(baseline)
                .degradationPct(degradation)
                .recommendation(severity.getRecommendation())
                .build();
    }

    /**
     * Checks the recent mean of every baselined metric. Detected regressions replace the latest
     * finding for their key; metrics back within range clear it.
     *
     * @return findings detected in this sweep
     */
    public List<RegressionFinding> runRegressionSweep() {
        Instant now = clock.instant();
        Instant since = now.minus(properties.getSweepWindow());
        List<RegressionFinding> detected = new ArrayList<>();
        for (PerformanceBaseline baseline : baselineStore.findAll()) {
            List<PerformanceSample> recent = sampleStore.findSince(baseline.getComponent(), baseline.getMetric(), since);
            if (recent.isEmpty()) {
                continue;
            }
            double recentMean = recent.stream().mapToDouble(PerformanceSample::getValue).average().orElse(0.0);
            RegressionResult result = detectRegression(baseline.getComponent(), baseline.getMetric(), recentMean);
            if (!result.isDetected()) {
                latestFindings.remove(baseline.key());
                continue;
            }
            RegressionFinding finding = RegressionFinding.builder()
                    .component(result.getComponent())
                    .metric(result.getMetric())
                    .value(recentMean)
                    .severity(result.getSeverity())
                    .degradationPct(result.getDegradationPct())
                    .recommendation(result.getRecommendation())
                    .detectedAt(now)
                    .build();
            latestFindings.put(baseline.key(), finding);
            detected.add(finding);
            metricsCollector.recordRegression(result.getSeverity().name());
            log.warn("[BASELINE] Regression {}: value={} mean={} upper={} → {}",
                    finding.describe(),
                    String.format(Locale.ROOT, "%.1f", recentMean),
                    String.format(Locale.ROOT, "%.1f", baseline.getMean()),
                    String.format(Locale.ROOT, "%.1f", baseline.getUpperBand()),
                    result.getRecommendation());
        }
        return detected;
    }

    public List<RegressionFinding> currentFindings() {
        List<RegressionFinding> out = new ArrayList<>(latestFindings.values());
        out.sort(Comparator.comparing(RegressionFinding::getSeverity).reversed()
                .thenComparing(RegressionFinding::getComponent));
        return out;
    }

    public List<PerformanceBaseline> getBaselines() {
        return baselineStore.findAll();
    }

    // ------------------------------------------------------------------ //

    static RegressionSeverity severityOf(double value, double mean) {
        if (value > 2.0 * mean) return RegressionSeverity.SEVERE;
        if (value > 1.5 * mean) return RegressionSeverity.MODERATE;
        return RegressionSeverity.MINOR;
    }

    static double mean(double[] values) {
        double sum = 0;
        for (double v : values) sum += v;
        return values.length == 0 ? 0.0 : sum / values.length;
    }

    /** Linear interpolation between closest ranks; {@code sorted} must be ascending. */
    static double percentile(double[] sorted, double p) {
        if (sorted.length == 0) return 0.0;
        if (sorted.length == 1) return sorted[0];
        double rank = p * (sorted.length - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (rank - lo);
    }
}
