package com.di.insightnova.recommendation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface UserContextStore {

    void upsert(UserContext context);

    Optional<UserContext> find(String userId);

    /** Unexpired contexts updated at or after {@code since}, most recently updated first. */
    List<UserContext> findActive(Instant since, Instant now, int limit);

    int deleteExpired(Instant now);
}
