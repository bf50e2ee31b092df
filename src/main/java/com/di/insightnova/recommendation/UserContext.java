package com.di.insightnova.recommendation;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * What a user is currently working on, as last reported through the context API.
 */
@Value
@Builder(toBuilder = true)
public class UserContext {
    String userId;
    String role;
    List<String> activeProjects;
    List<String> recentQueries;
    String discussionContext;
    List<String> constraints;
    Instant updatedAt;
    Instant expiresAt;

    /** Text describing the user's current situation, used for retrieval and prompts. */
    public String situation() {
        StringBuilder sb = new StringBuilder();
        if (discussionContext != null && !discussionContext.isBlank()) {
            sb.append(discussionContext.trim());
        }
        if (recentQueries != null && !recentQueries.isEmpty()) {
            if (sb.length() > 0) sb.append(". ");
            sb.append("Recent questions: ").append(String.join("; ", recentQueries));
        }
        if (sb.length() == 0 && activeProjects != null && !activeProjects.isEmpty()) {
            sb.append("Working on ").append(String.join(", ", activeProjects));
        }
        return sb.toString();
    }
}
