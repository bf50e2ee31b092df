package com.di.insightnova.pipeline.validation;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ValidationResult {
    /** Schema verdict from the model. */
    boolean schemaValid;
    /** Data quality score in [0,1]. */
    double score;
    List<String> issues;
    List<String> fixes;
    /** Score threshold the verdict was judged against. */
    double threshold;

    /** Schema verdict and a score strictly above the threshold. */
    public boolean isAccepted() {
        return schemaValid && score > threshold;
    }
}
