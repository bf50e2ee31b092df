package com.di.insightnova.insight;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface InsightStore {

    void saveAll(Collection<StreamInsight> insights);

    Optional<StreamInsight> findById(String id);

    /**
     * Insights created at or after {@code since} with confidence strictly above
     * {@code minConfidence}, highest confidence first, newest first on ties.
     */
    List<StreamInsight> findConfidentSince(Instant since, double minConfidence);

    /**
     * Insights of the given types targeted at {@code userId} or at everyone, created at
     * or after {@code since}, newest first.
     */
    List<StreamInsight> findForUser(String userId, String everyone, Set<InsightType> types, Instant since,
                                    int limit);

    List<StreamInsight> findBySourceItem(String sourceItemId);

    long countCreatedSince(Instant since);

    int deleteExpired(Instant now);
}
