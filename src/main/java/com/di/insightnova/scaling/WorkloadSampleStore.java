package com.di.insightnova.scaling;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface WorkloadSampleStore {

    void save(WorkloadSample sample);

    Optional<WorkloadSample> findLatest();

    /** Newest first. */
    List<WorkloadSample> findRecent(int limit);

    int deleteBefore(Instant cutoff);
}
