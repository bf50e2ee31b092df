package com.di.insightnova.alert;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AnomalyAssessment {
    boolean anomalyDetected;
    String description;
    double confidence;
    List<String> investigationSteps;
}
