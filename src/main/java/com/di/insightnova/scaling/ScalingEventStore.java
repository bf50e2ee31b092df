package com.di.insightnova.scaling;

import java.util.List;

public interface ScalingEventStore {

    void save(ScalingEvent event);

    /** Newest first. */
    List<ScalingEvent> findRecent(int limit);
}
