package com.typewarden.core.analysis;

import com.typewarden.core.config.CampaignProperties;
import com.typewarden.core.events.CampaignEvent;
import com.typewarden.core.events.EventBus;
import com.typewarden.core.model.AnyTypeCategory;
import com.typewarden.core.model.BatchResult;
import com.typewarden.core.model.FailedReplacement;
import com.typewarden.core.model.TypeReplacement;
import com.typewarden.core.persistence.BoundedHistory;
import com.typewarden.core.persistence.HistoryStore;
import com.typewarden.core.persistence.JsonFileHistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates real replacement outcomes from completed batches.
 * <p>
 * Listens for {@link CampaignEvent#BATCH_COMPLETED}; never calls back into the
 * replacement path.
 */
@Service
public class ReplacementOutcomeTracker {

    private static final Logger log = LoggerFactory.getLogger(ReplacementOutcomeTracker.class);

    private static final int MAX_SAFETY_EVENTS = 1000;

    private final Clock clock;
    private final BoundedHistory<SuccessRatePoint> trend;
    private final Map<AnyTypeCategory, int[]> byCategory = new EnumMap<>(AnyTypeCategory.class);
    private final Deque<SafetyEvent> safetyEvents = new ArrayDeque<>();
    private int attempted;
    private int succeeded;
    private Instant lastChange;

    @Autowired
    public ReplacementOutcomeTracker(CampaignProperties properties, EventBus eventBus, Clock clock) {
        this(eventBus, clock, properties.getHistory().getSuccessRateCapacity(),
                new JsonFileHistoryStore<>(
                        Path.of(properties.getHistory().getDirectory(), "success-rates.json"),
                        SuccessRatePoint.class));
    }

    public ReplacementOutcomeTracker(EventBus eventBus, Clock clock, int trendCapacity,
                                     HistoryStore<SuccessRatePoint> trendStore) {
        this.clock = clock;
        this.trend = new BoundedHistory<>(trendCapacity, trendStore);
        this.lastChange = clock.instant();
        eventBus.subscribe(CampaignEvent.BATCH_COMPLETED, event -> {
            Object result = event.payload().get("result");
            if (result instanceof BatchResult batch) {
                record(batch);
            }
        });
    }

    public synchronized void record(BatchResult batch) {
        for (TypeReplacement applied : batch.appliedReplacements()) {
            count(applied.category(), true);
        }
        for (FailedReplacement failed : batch.failedReplacements()) {
            count(failed.replacement().category(), false);
        }
        if (!batch.appliedReplacements().isEmpty()) {
            lastChange = clock.instant();
        }
        long gated = batch.failedReplacements().stream()
                .filter(f -> f.reason() == FailedReplacement.Reason.SAFETY_GATE)
                .count();
        if (gated > 0) {
            recordSafetyEvent(SafetyEvent.Kind.SAFETY_GATE,
                    batch.batchId() + ": " + gated + " replacement(s) below the safety threshold");
        }
        if (batch.rollbackPerformed()) {
            recordSafetyEvent(SafetyEvent.Kind.ROLLBACK,
                    batch.batchId() + ": " + String.join("; ", batch.compilationErrors()));
        }
        if (batch.attemptedCount() > 0) {
            trend.append(new SuccessRatePoint(clock.instant(), currentSuccessRate()));
        }
        log.debug("Recorded batch {}: {} attempted, {} succeeded overall", batch.batchId(), attempted, succeeded);
    }

    public synchronized void recordSafetyEvent(SafetyEvent.Kind kind, String detail) {
        safetyEvents.addLast(new SafetyEvent(clock.instant(), kind, detail));
        while (safetyEvents.size() > MAX_SAFETY_EVENTS) {
            safetyEvents.removeFirst();
        }
    }

    public synchronized List<SafetyEvent> safetyEventsSince(Instant since) {
        return safetyEvents.stream().filter(e -> !e.timestamp().isBefore(since)).toList();
    }

    /** Percentage of attempted replacements that were committed, 0 before any attempt. */
    public synchronized double currentSuccessRate() {
        return attempted > 0 ? succeeded * 100.0 / attempted : 0.0;
    }

    public synchronized Map<AnyTypeCategory, Double> categorySuccessRates() {
        var rates = new EnumMap<AnyTypeCategory, Double>(AnyTypeCategory.class);
        byCategory.forEach((category, counts) ->
                rates.put(category, counts[0] > 0 ? counts[1] * 100.0 / counts[0] : 0.0));
        return rates;
    }

    public synchronized int totalAttempted() {
        return attempted;
    }

    public synchronized int totalSucceeded() {
        return succeeded;
    }

    /** When the committed count last grew; construction time if it never has. */
    public synchronized Instant lastProgressAt() {
        return lastChange;
    }

    public List<SuccessRatePoint> trend() {
        return trend.snapshot();
    }

    private void count(AnyTypeCategory category, boolean success) {
        attempted++;
        if (success) succeeded++;
        if (category != null) {
            int[] counts = byCategory.computeIfAbsent(category, k -> new int[2]);
            counts[0]++;
            if (success) counts[1]++;
        }
    }
}
