package com.di.insightnova.pipeline.staging;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/ingest")
@RequiredArgsConstructor
public class IngestionController {

    private final IngestionService ingestionService;

    /**
     * Stages one raw event for the next pipeline run. Returns 202 with the new item id.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, String>> ingest(@RequestBody IngestRequest request) {
        String itemId = ingestionService.ingest(request.getSource(), request.getPayload(), request.getPriority());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("itemId", itemId));
    }
}
