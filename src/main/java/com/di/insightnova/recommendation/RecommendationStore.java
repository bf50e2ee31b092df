package com.di.insightnova.recommendation;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

public interface RecommendationStore {

    void saveAll(Collection<Recommendation> recommendations);

    Optional<Recommendation> findById(String id);

    /**
     * Unexpired ({@code expiresAt > now}) PENDING or VIEWED recommendations of the given types,
     * priority desc then confidence desc.
     */
    List<Recommendation> findActive(String userId, Set<RecommendationType> types, Instant now, int limit);

    /** Whether the user has an unexpired recommendation created at or after {@code since}. */
    boolean hasFreshSince(String userId, Instant since, Instant now);

    /** @return the updated recommendation, empty when the id is unknown */
    Optional<Recommendation> update(String id, UnaryOperator<Recommendation> change);

    int deleteExpired(Instant now);
}
