package com.di.insightnova.pipeline.staging;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class Enrichment {
    String content;
    List<String> entities;
    List<String> categories;
    List<String> sourcesUsed;
    Instant enrichedAt;
}
