package com.di.insightnova.alert;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.stereotype.Component;

/**
 * Default channel: writes each alert as a structured log line for a log-based notifier to pick up.
 */
@Slf4j
@Component
@ConditionalOnMissingBean(value = NotificationChannel.class, ignored = LoggingNotificationChannel.class)
public class LoggingNotificationChannel implements NotificationChannel {

    @Override
    public boolean deliver(Alert alert) {
        log.info("[NOTIFY] alertId={} urgency={} source={} message=\"{}\"",
                alert.getId(), alert.getUrgency(), alert.getSourceKey(),
                alert.getPersonalizedMessage() != null ? alert.getPersonalizedMessage() : alert.getMessage());
        return true;
    }
}
