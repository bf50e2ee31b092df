package com.di.insightnova.alert;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
public class AlertController {

    private final AlertService alertService;

    /**
     * Most recent alerts, optionally filtered by notification status.
     */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<Alert>> alerts(
            @RequestParam(required = false) NotificationStatus status,
            @RequestParam(required = false, defaultValue = "50") int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return ResponseEntity.ok(alertService.listAlerts(status, limit));
    }

    /**
     * Notification channel callback (SENT, ACKNOWLEDGED, RESOLVED). Backward moves return 409.
     */
    @PostMapping(value = "/{id}/notification-status", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Alert> updateNotificationStatus(@PathVariable String id,
                                                          @Valid @RequestBody NotificationStatusRequest request) {
        return ResponseEntity.ok(alertService.updateNotificationStatus(id, request.getStatus()));
    }
}
