package com.di.insightnova.alert;

/**
 * Outbound delivery of alerts (e-mail, chat, paging). Implementations return whether the channel
 * accepted the alert; delivery receipts come back through the alert status API.
 */
public interface NotificationChannel {

    boolean deliver(Alert alert);
}
