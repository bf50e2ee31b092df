package com.di.insightnova.performance;

import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/performance")
@RequiredArgsConstructor
public class PerformanceController {

    private final BaselineService baselineService;

    @GetMapping(value = "/baselines", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<PerformanceBaseline>> baselines() {
        return ResponseEntity.ok(baselineService.getBaselines());
    }

    /**
     * Checks one observed value against its baseline,
     * e.g. GET /api/performance/regression?component=inference_gateway&metric=latency_ms&value=2100
     */
    @GetMapping(value = "/regression", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RegressionResult> regression(@RequestParam String component,
                                                       @RequestParam String metric,
                                                       @RequestParam double value) {
        return ResponseEntity.ok(baselineService.detectRegression(component, metric, value));
    }
}
