package com.di.insightnova.stream;

import com.di.insightnova.pipeline.staging.StagedItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

/**
 * Publishes a validated staged item as a PENDING {@link StreamEvent}. Used by the pipeline's
 * distribution stage and by the stream job when an analysis task outlived its event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StreamEventPublisher {

    private final StreamEventStore streamEventStore;
    private final Clock clock;

    /** @return the stored event, which is the earlier one when the item was already published */
    public StreamEvent publish(StagedItem item) {
        StreamEvent event = streamEventStore.publishIfAbsent(StreamEvent.builder()
                .id(UUID.randomUUID().toString())
                .stagedItemId(item.getId())
                .source(item.getSource())
                .content(item.contentText())
                .embedding(item.getEmbedding())
                .priority(item.getPriority())
                .status(StreamEventStatus.PENDING)
                .publishedAt(clock.instant())
                .build());
        log.debug("[STREAM] Item {} published as stream event {}", item.getId(), event.getId());
        return event;
    }
}
