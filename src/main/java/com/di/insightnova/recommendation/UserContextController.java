package com.di.insightnova.recommendation;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserContextController {

    private final RecommendationService recommendationService;

    /**
     * Replaces the user's working context; the next recommendation cycle picks it up.
     */
    @PutMapping(value = "/{userId}/context", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<UserContext> putContext(@PathVariable String userId,
                                                  @Valid @RequestBody UserContextRequest request) {
        return ResponseEntity.ok(recommendationService.upsertContext(userId, request));
    }
}
