package com.di.insightnova.scaling;

import java.util.List;
import java.util.Optional;

public interface ScalingPolicyStore {

    List<ScalingPolicy> findAll();

    Optional<ScalingPolicy> findByType(ResourceType type);

    /** @return false when a policy for the resource type already exists */
    boolean insertIfAbsent(ScalingPolicy policy);

    /**
     * Replaces the stored policy if its version still equals {@code expectedVersion}; the stored
     * version becomes {@code expectedVersion + 1}.
     *
     * @return false when another writer got there first
     */
    boolean compareAndSet(ScalingPolicy updated, long expectedVersion);
}
