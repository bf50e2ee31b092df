package com.di.insightnova.recommendation;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of {@code PUT /api/users/{userId}/context}.
 */
@Data
public class UserContextRequest {
    @NotBlank
    private String role;
    private List<String> activeProjects = new ArrayList<>();
    private List<String> recentQueries = new ArrayList<>();
    private String discussionContext;
    private List<String> constraints = new ArrayList<>();
}
