package com.di.insightnova.pipeline;

import lombok.Builder;
import lombok.Value;

/**
 * Counts for one pipeline cycle.
 */
@Value
@Builder
public class PipelineRunSummary {
    int claimed;
    int valid;
    int invalid;
    int published;
    int retrying;
    int failed;
    int resumed;
}
