package com.di.insightnova.performance;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryBaselineStore implements BaselineStore {

    private volatile Map<String, PerformanceBaseline> baselines = Map.of();

    @Override
    public void replaceAll(Collection<PerformanceBaseline> fresh) {
        Map<String, PerformanceBaseline> next = new ConcurrentHashMap<>();
        for (PerformanceBaseline b : fresh) {
            next.put(b.key(), b);
        }
        baselines = next;
    }

    @Override
    public Optional<PerformanceBaseline> find(String component, String metric) {
        return Optional.ofNullable(baselines.get(component + "/" + metric));
    }

    @Override
    public List<PerformanceBaseline> findAll() {
        List<PerformanceBaseline> out = new ArrayList<>(baselines.values());
        out.sort(Comparator.comparing(PerformanceBaseline::key));
        return out;
    }
}
