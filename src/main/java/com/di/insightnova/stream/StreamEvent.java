package com.di.insightnova.stream;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * An enriched, embedded record published downstream by the pipeline's distribution stage and
 * analysed by the stream job. One per staged item.
 */
@Value
@Builder(toBuilder = true)
public class StreamEvent {
    String id;
    String stagedItemId;
    String source;
    String content;
    float[] embedding;
    int priority;
    StreamEventStatus status;
    Instant publishedAt;
    Instant completedAt;
}
