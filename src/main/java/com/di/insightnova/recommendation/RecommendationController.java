package com.di.insightnova.recommendation;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Set;

/**
 * REST API for recommendations.
 * e.g. GET /api/recommendations?userId=u1&types=ACTION_ITEM,DECISION_SUPPORT&limit=5
 */
@RestController
@RequestMapping("/api/recommendations")
@RequiredArgsConstructor
public class RecommendationController {

    private final RecommendationService recommendationService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<Recommendation>> recommendations(
            @RequestParam String userId,
            @RequestParam(required = false) Set<RecommendationType> types,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(recommendationService.getRecommendations(userId, types, limit));
    }

    /**
     * Records a user interaction. Backward moves return 409.
     */
    @PostMapping(value = "/{id}/status", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Recommendation> updateStatus(@PathVariable String id,
                                                       @Valid @RequestBody StatusUpdateRequest request) {
        return ResponseEntity.ok(recommendationService.updateStatus(id, request.getStatus()));
    }
}
