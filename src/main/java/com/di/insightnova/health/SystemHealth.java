package com.di.insightnova.health;

import com.di.insightnova.performance.RegressionFinding;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class SystemHealth {
    /** healthy, degraded or unhealthy. */
    String status;
    /** HIGH or CRITICAL alerts triggered in the last 24 hours and not resolved. */
    long activeAlerts;
    long pendingStreamEvents;
    long pendingNotifications;
    long insightsLastHour;
    /** 100 minus a penalty per current regression finding, floored at 0. */
    double performanceScore;
    List<RegressionFinding> regressions;
    Instant checkedAt;
}
