package com.di.insightnova.health;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class PipelineHealth {
    /** Staged items waiting for validation. */
    long pending;
    /** Items ingested in the last hour that reached a terminal status. */
    long throughputPerHour;
    /** Share of last hour's terminal items that were INVALID or NEEDS_REVIEW. */
    double errorRate;
    /** Mean claim-to-completion time of tasks completed in the last hour. */
    double avgLatencySeconds;
    /** Pending staged items, pending stream events and retrying tasks. */
    long backlog;
    Instant checkedAt;
}
