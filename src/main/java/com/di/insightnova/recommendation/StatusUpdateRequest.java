package com.di.insightnova.recommendation;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class StatusUpdateRequest {
    @NotNull
    private InteractionStatus status;
}
