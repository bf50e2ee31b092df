package com.di.insightnova.scaling;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Bounded audit log; the oldest events are dropped past {@link #CAPACITY}.
 */
@Component
public class InMemoryScalingEventStore implements ScalingEventStore {

    static final int CAPACITY = 10_000;

    private final ConcurrentLinkedDeque<ScalingEvent> events = new ConcurrentLinkedDeque<>();

    @Override
    public void save(ScalingEvent event) {
        events.addLast(event);
        while (events.size() > CAPACITY) {
            events.pollFirst();
        }
    }

    @Override
    public List<ScalingEvent> findRecent(int limit) {
        List<ScalingEvent> out = new ArrayList<>();
        for (Iterator<ScalingEvent> it = events.descendingIterator(); it.hasNext() && out.size() < limit; ) {
            out.add(it.next());
        }
        return out;
    }
}
