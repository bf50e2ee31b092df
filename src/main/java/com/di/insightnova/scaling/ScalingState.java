package com.di.insightnova.scaling;

/**
 * Per-resource controller state: EVALUATING → {SCALE_UP, SCALE_DOWN, MAINTAIN} → COOLDOWN → EVALUATING.
 * A policy is left in COOLDOWN after an executed action and reported as EVALUATING again once
 * its cooldown has elapsed.
 */
public enum ScalingState {
    EVALUATING,
    SCALE_UP,
    SCALE_DOWN,
    MAINTAIN,
    COOLDOWN
}
