package com.di.insightnova.ai.gateway;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Rolling record of recent gateway calls, read by the workload monitor for calls/min and
 * average latency. Entries older than the retention window are dropped on every write.
 */
@Component
public class GatewayActivityTracker {

    private static final Duration RETENTION = Duration.ofMinutes(15);

    private final ConcurrentLinkedDeque<long[]> calls = new ConcurrentLinkedDeque<>();

    public void record(Instant at, long latencyMs) {
        calls.addLast(new long[]{at.toEpochMilli(), latencyMs});
        long cutoff = at.minus(RETENTION).toEpochMilli();
        while (true) {
            long[] head = calls.peekFirst();
            if (head == null || head[0] >= cutoff) {
                break;
            }
            calls.pollFirst();
        }
    }

    public Snapshot snapshot(Instant now, Duration window) {
        long from = now.minus(window).toEpochMilli();
        long count = 0;
        long totalLatency = 0;
        for (Iterator<long[]> it = calls.descendingIterator(); it.hasNext(); ) {
            long[] c = it.next();
            if (c[0] < from) {
                break;
            }
            count++;
            totalLatency += c[1];
        }
        double minutes = Math.max(1.0, window.toSeconds() / 60.0);
        return new Snapshot(count / minutes, count == 0 ? 0.0 : (double) totalLatency / count);
    }

    public record Snapshot(double callsPerMinute, double averageLatencyMs) {
    }
}
