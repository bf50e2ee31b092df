package com.di.insightnova.scaling;

public enum ResourceType {
    COMPUTE,
    MEMORY,
    STORAGE,
    AI_QUOTA
}
