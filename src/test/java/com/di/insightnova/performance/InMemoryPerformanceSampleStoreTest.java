package com.di.insightnova.performance;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryPerformanceSampleStore Tests")
class InMemoryPerformanceSampleStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private static PerformanceSample sample(int second, double value) {
        return PerformanceSample.builder()
                .component("pipeline")
                .metric("duration_ms")
                .value(value)
                .recordedAt(T0.plusSeconds(second))
                .build();
    }

    @Test
    @DisplayName("Should evict the oldest samples once the cap is reached")
    void testBoundedByCapacity() {
        InMemoryPerformanceSampleStore store = new InMemoryPerformanceSampleStore(3);
        for (int i = 0; i < 5; i++) {
            store.record(sample(i, 100 + i));
        }

        assertEquals(3, store.size());
        List<PerformanceSample> kept = store.findSince("pipeline", "duration_ms", T0);
        assertEquals(List.of(102.0, 103.0, 104.0),
                List.of(kept.get(0).getValue(), kept.get(1).getValue(), kept.get(2).getValue()));
    }

    @Test
    @DisplayName("Should take the cap from the performance properties")
    void testCapacityFromProperties() {
        PerformanceProperties properties = new PerformanceProperties();
        properties.setMaxInMemorySamples(2);
        InMemoryPerformanceSampleStore store = new InMemoryPerformanceSampleStore(properties);

        store.record(sample(0, 1));
        store.record(sample(1, 2));
        store.record(sample(2, 3));

        assertEquals(2, store.size());
        assertEquals(1, store.findSince(T0.plusSeconds(2)).size());
    }

    @Test
    @DisplayName("Should reject a non-positive cap")
    void testRejectsInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryPerformanceSampleStore(0));
    }

    @Test
    @DisplayName("Should purge by age and ignore incomplete samples")
    void testPurgeAndIgnore() {
        InMemoryPerformanceSampleStore store = new InMemoryPerformanceSampleStore();
        store.record(sample(0, 1));
        store.record(sample(60, 2));
        store.record(PerformanceSample.builder().metric("duration_ms").value(1).recordedAt(T0).build());

        assertEquals(1, store.purgeBefore(T0.plusSeconds(30)));
        assertEquals(1, store.size());
    }
}
