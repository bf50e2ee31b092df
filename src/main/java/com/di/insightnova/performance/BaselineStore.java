package com.di.insightnova.performance;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface BaselineStore {

    /** Replaces every stored baseline with the given set. */
    void replaceAll(Collection<PerformanceBaseline> baselines);

    Optional<PerformanceBaseline> find(String component, String metric);

    List<PerformanceBaseline> findAll();
}
