package com.di.insightnova.recommendation;

/**
 * How the user has interacted with a recommendation: PENDING → VIEWED → {ACTED_UPON | DISMISSED},
 * with PENDING allowed to jump straight to either outcome. ACTED_UPON and DISMISSED are final.
 */
public enum InteractionStatus {
    PENDING,
    VIEWED,
    ACTED_UPON,
    DISMISSED;

    public boolean isFinal() {
        return this == ACTED_UPON || this == DISMISSED;
    }

    public boolean canMoveTo(InteractionStatus next) {
        return !isFinal() && next.ordinal() > ordinal();
    }
}
