package com.typewarden.core.monitor;

import com.typewarden.core.config.CampaignProperties;
import com.typewarden.core.persistence.BoundedHistory;
import com.typewarden.core.persistence.HistoryStore;
import com.typewarden.core.persistence.JsonFileHistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Optional;

/**
 * Persistent, capped record of raised alerts.
 * <p>
 * An alert whose type was already recorded within the dedup window is suppressed,
 * so repeated ticks over the same breach raise it once.
 */
@Service
public class AlertHistory {

    private static final Logger log = LoggerFactory.getLogger(AlertHistory.class);

    static final Duration SUMMARY_WINDOW = Duration.ofHours(24);

    private final Clock clock;
    private final Duration dedupWindow;
    private final BoundedHistory<Alert> alerts;

    @Autowired
    public AlertHistory(CampaignProperties properties, Clock clock) {
        this(clock,
                Duration.ofMinutes(properties.getMonitor().getDedupWindowMinutes()),
                properties.getHistory().getAlertCapacity(),
                new JsonFileHistoryStore<>(Path.of(properties.getHistory().getDirectory(), "alerts.json"), Alert.class));
    }

    public AlertHistory(Clock clock, Duration dedupWindow, int capacity, HistoryStore<Alert> store) {
        this.clock = clock;
        this.dedupWindow = dedupWindow;
        this.alerts = new BoundedHistory<>(capacity, store);
    }

    /**
     * Records the alert unless one of the same type was recorded within the dedup window.
     *
     * @return the alert if it was recorded, empty if it was suppressed
     */
    public synchronized Optional<Alert> record(Alert alert) {
        Instant cutoff = alert.timestamp().minus(dedupWindow);
        boolean duplicate = alerts.snapshot().stream()
                .anyMatch(a -> a.type() == alert.type() && a.timestamp().isAfter(cutoff));
        if (duplicate) {
            log.debug("Suppressed duplicate {} alert", alert.type().key());
            return Optional.empty();
        }
        alerts.append(alert);
        return Optional.of(alert);
    }

    public List<Alert> recent(Duration window) {
        Instant cutoff = clock.instant().minus(window);
        return alerts.snapshot().stream().filter(a -> !a.timestamp().isBefore(cutoff)).toList();
    }

    public List<Alert> all() {
        return alerts.snapshot();
    }

    public int size() {
        return alerts.size();
    }

    public AlertSummary summary() {
        Instant windowStart = clock.instant().minus(SUMMARY_WINDOW);
        List<Alert> recent = recent(SUMMARY_WINDOW);
        var byType = new EnumMap<AlertType, Integer>(AlertType.class);
        int critical = 0;
        int high = 0;
        for (Alert alert : recent) {
            byType.merge(alert.type(), 1, Integer::sum);
            if (alert.severity() == AlertSeverity.CRITICAL) critical++;
            if (alert.severity() == AlertSeverity.HIGH) high++;
        }
        return new AlertSummary(windowStart, recent.size(), critical, high, byType, recent);
    }
}
