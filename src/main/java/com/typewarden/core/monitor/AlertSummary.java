package com.typewarden.core.monitor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Alert counts since {@code windowStart}.
 */
public record AlertSummary(
    Instant windowStart,
    int total,
    int critical,
    int high,
    Map<AlertType, Integer> byType,
    List<Alert> recent
) {
    public AlertSummary {
        byType = Map.copyOf(byType);
        recent = List.copyOf(recent);
    }
}
