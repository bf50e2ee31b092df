package com.di.insightnova.alert;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SignificanceAssessment {
    boolean significant;
    double score;
    String explanation;
    String recommendedAction;
}
