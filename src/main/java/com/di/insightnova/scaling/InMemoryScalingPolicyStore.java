package com.di.insightnova.scaling;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(name = "insightnova.persistence.jdbc-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryScalingPolicyStore implements ScalingPolicyStore {

    private final Map<ResourceType, ScalingPolicy> policies = new ConcurrentHashMap<>();

    @Override
    public List<ScalingPolicy> findAll() {
        List<ScalingPolicy> out = new ArrayList<>(policies.values());
        out.sort(Comparator.comparing(ScalingPolicy::getResourceType));
        return out;
    }

    @Override
    public Optional<ScalingPolicy> findByType(ResourceType type) {
        return Optional.ofNullable(policies.get(type));
    }

    @Override
    public boolean insertIfAbsent(ScalingPolicy policy) {
        return policies.putIfAbsent(policy.getResourceType(), policy.toBuilder().version(0).build()) == null;
    }

    @Override
    public boolean compareAndSet(ScalingPolicy updated, long expectedVersion) {
        boolean[] swapped = {false};
        policies.computeIfPresent(updated.getResourceType(), (type, current) -> {
            if (current.getVersion() != expectedVersion) {
                return current;
            }
            swapped[0] = true;
            return updated.toBuilder().version(expectedVersion + 1).build();
        });
        return swapped[0];
    }
}
