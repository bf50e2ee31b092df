package com.di.insightnova.performance;

import java.time.Instant;
import java.util.List;

public interface PerformanceSampleStore {

    void record(PerformanceSample sample);

    List<PerformanceSample> findSince(Instant since);

    List<PerformanceSample> findSince(String component, String metric, Instant since);

    int purgeBefore(Instant cutoff);
}
