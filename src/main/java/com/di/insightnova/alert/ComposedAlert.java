package com.di.insightnova.alert;

import com.di.insightnova.insight.Urgency;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ComposedAlert {
    String message;
    Urgency urgency;
    String personalizedMessage;
}
