package com.typewarden.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the replacement path or the monitor.
 *
 * @param eventType one of the constants below
 * @param source    batch id or monitor tick the event belongs to
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record CampaignEvent(
    String eventType,
    String source,
    Map<String, Object> payload,
    Instant timestamp
) {
    public static final String BATCH_COMPLETED = "batch.completed";
    public static final String ALERT_RAISED = "alert.raised";
    public static final String DASHBOARD_UPDATED = "dashboard.updated";
}
