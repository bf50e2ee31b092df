package com.di.insightnova.scaling;

public enum ScalingAction {
    SCALE_UP,
    SCALE_DOWN,
    MAINTAIN
}
