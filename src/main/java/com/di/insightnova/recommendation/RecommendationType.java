package com.di.insightnova.recommendation;

public enum RecommendationType {
    ACTION_ITEM("Recommended Actions", 0.85),
    INFORMATION("Relevant Information", 0.80),
    DECISION_SUPPORT("Decision Support", 0.90);

    private final String title;
    private final double confidence;

    RecommendationType(String title, double confidence) {
        this.title = title;
        this.confidence = confidence;
    }

    public String getTitle() {
        return title;
    }

    public double getConfidence() {
        return confidence;
    }
}
