package com.typewarden.core.monitor;

import java.time.Instant;
import java.util.Map;

/**
 * A threshold breach raised by the monitor.
 *
 * @param type      what was breached
 * @param severity  how urgent it is
 * @param message   human-readable description
 * @param timestamp when the monitor raised it
 * @param data      the measured values behind the alert
 */
public record Alert(
    AlertType type,
    AlertSeverity severity,
    String message,
    Instant timestamp,
    Map<String, Object> data
) {
    public Alert {
        data = data != null ? Map.copyOf(data) : Map.of();
    }
}
