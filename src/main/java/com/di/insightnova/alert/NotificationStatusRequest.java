package com.di.insightnova.alert;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class NotificationStatusRequest {
    @NotNull
    private NotificationStatus status;
}
