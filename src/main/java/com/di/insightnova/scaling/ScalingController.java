package com.di.insightnova.scaling;

import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for the scaling controller: policies, decision audit log and workload samples.
 */
@RestController
@RequestMapping("/api/scaling")
@RequiredArgsConstructor
public class ScalingController {

    private final ScalingService scalingService;

    @GetMapping(value = "/policies", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<ScalingPolicy>> policies() {
        return ResponseEntity.ok(scalingService.getPolicies());
    }

    /**
     * Creates or partially updates a policy. Invalid policies return 400, a concurrent update 409.
     */
    @PutMapping(value = "/policies/{type}", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ScalingPolicy> putPolicy(@PathVariable ResourceType type,
                                                   @RequestBody PolicyUpdateRequest request) {
        return ResponseEntity.ok(scalingService.upsertPolicy(type, request));
    }

    @GetMapping(value = "/events", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<ScalingEvent>> events(@RequestParam(required = false, defaultValue = "50") int limit) {
        return ResponseEntity.ok(scalingService.getEvents(positive(limit)));
    }

    @GetMapping(value = "/samples", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<WorkloadSample>> samples(@RequestParam(required = false, defaultValue = "50") int limit) {
        return ResponseEntity.ok(scalingService.getSamples(positive(limit)));
    }

    private static int positive(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return limit;
    }
}
