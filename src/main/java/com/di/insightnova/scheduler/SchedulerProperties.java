package com.di.insightnova.scheduler;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * {@code insightnova.scheduler.*}: executor size and per-job timeouts. Cadences are read directly
 * by {@link ScheduledJobs} through {@code @Scheduled} placeholders.
 */
@Data
@ConfigurationProperties(prefix = "insightnova.scheduler")
public class SchedulerProperties {

    private boolean enabled = true;
    private int poolSize = 4;
    private Duration defaultTimeout = Duration.ofMinutes(2);
    /** Job name → timeout, e.g. {@code pipeline: 150s}. */
    private Map<String, Duration> timeouts = new HashMap<>();

    public Duration timeoutFor(String jobName) {
        return timeouts.getOrDefault(jobName, defaultTimeout);
    }
}
