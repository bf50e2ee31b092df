package com.di.insightnova.alert;

import java.util.List;

/**
 * Who an alert is written for.
 */
public record AlertAudience(String role, List<String> activeProjects) {
}
