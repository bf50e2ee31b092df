package com.di.insightnova.scaling;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Samples ordered by sampling time; the id breaks ties between samples taken at the same instant.
 */
@Component
public class InMemoryWorkloadSampleStore implements WorkloadSampleStore {

    private static final Comparator<WorkloadSample> ORDER =
            Comparator.comparing(WorkloadSample::getSampledAt).thenComparing(WorkloadSample::getId);

    private final ConcurrentSkipListMap<WorkloadSample, Boolean> samples = new ConcurrentSkipListMap<>(ORDER);

    @Override
    public void save(WorkloadSample sample) {
        samples.put(sample, Boolean.TRUE);
    }

    @Override
    public Optional<WorkloadSample> findLatest() {
        return samples.isEmpty() ? Optional.empty() : Optional.ofNullable(samples.lastKey());
    }

    @Override
    public List<WorkloadSample> findRecent(int limit) {
        List<WorkloadSample> out = new ArrayList<>(Math.min(limit, samples.size()));
        for (WorkloadSample s : samples.descendingKeySet()) {
            if (out.size() >= limit) break;
            out.add(s);
        }
        return out;
    }

    @Override
    public int deleteBefore(Instant cutoff) {
        int removed = 0;
        for (WorkloadSample s : samples.keySet()) {
            if (!s.getSampledAt().isBefore(cutoff)) break;
            if (samples.remove(s) != null) removed++;
        }
        return removed;
    }
}
