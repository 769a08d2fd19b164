package com.typewarden.core.analysis;

import com.typewarden.core.events.CampaignEvent;
import com.typewarden.core.events.EventBus;
import com.typewarden.core.model.AnyTypeCategory;
import com.typewarden.core.model.BatchResult;
import com.typewarden.core.model.FailedReplacement;
import com.typewarden.core.model.ReplacementState;
import com.typewarden.core.model.TypeReplacement;
import com.typewarden.core.persistence.HistoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReplacementOutcomeTrackerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final EventBus eventBus = new EventBus();
    private HistoryStore<SuccessRatePoint> store;
    private ReplacementOutcomeTracker tracker;

    @BeforeEach
    void setUp() {
        store = HistoryStore.inMemory();
        tracker = new ReplacementOutcomeTracker(eventBus, Clock.fixed(NOW, ZoneOffset.UTC), 10, store);
    }

    private static TypeReplacement replacement(AnyTypeCategory category) {
        return new TypeReplacement("any", "unknown", "src/a.ts", 1, 0.9, false, category);
    }

    private static BatchResult committed(TypeReplacement... applied) {
        return new BatchResult("batch-1", true, List.of(applied), List.of(), false, List.of(),
                Map.of("src/a.ts", ReplacementState.COMMITTED));
    }

    private static BatchResult rolledBack(TypeReplacement replacement) {
        return new BatchResult("batch-2", false, List.of(),
                List.of(new FailedReplacement(replacement, FailedReplacement.Reason.COMPILATION, "rolled back")),
                true, List.of("src/a.ts(1,1): error TS2304: x"), Map.of("src/a.ts", ReplacementState.ROLLED_BACK));
    }

    @Test
    @DisplayName("success rate is zero before any attempt")
    void noAttempts() {
        assertEquals(0.0, tracker.currentSuccessRate());
        assertEquals(0, tracker.totalAttempted());
        assertTrue(tracker.trend().isEmpty());
    }

    @Test
    @DisplayName("learns outcomes from published batch results")
    void learnsFromEvents() {
        eventBus.publish(new CampaignEvent(CampaignEvent.BATCH_COMPLETED, "batch-1",
                Map.of("result", committed(replacement(AnyTypeCategory.ARRAY_TYPE))), NOW));
        eventBus.publish(new CampaignEvent(CampaignEvent.BATCH_COMPLETED, "batch-2",
                Map.of("result", rolledBack(replacement(AnyTypeCategory.RECORD_TYPE))), NOW));

        assertEquals(2, tracker.totalAttempted());
        assertEquals(1, tracker.totalSucceeded());
        assertEquals(50.0, tracker.currentSuccessRate());
        assertEquals(100.0, tracker.categorySuccessRates().get(AnyTypeCategory.ARRAY_TYPE));
        assertEquals(0.0, tracker.categorySuccessRates().get(AnyTypeCategory.RECORD_TYPE));
        assertEquals(2, tracker.trend().size());
        assertEquals(2, store.load().size());
    }

    @Test
    @DisplayName("a rollback is recorded as a safety event")
    void rollbackIsSafetyEvent() {
        tracker.record(rolledBack(replacement(AnyTypeCategory.ARRAY_TYPE)));

        List<SafetyEvent> events = tracker.safetyEventsSince(NOW.minusSeconds(60));
        assertEquals(1, events.size());
        assertEquals(SafetyEvent.Kind.ROLLBACK, events.get(0).kind());
        assertTrue(events.get(0).detail().startsWith("batch-2: "));
    }

    @Test
    @DisplayName("safety-gate rejections are recorded once per batch")
    void safetyGateIsSafetyEvent() {
        TypeReplacement risky = replacement(AnyTypeCategory.FUNCTION_PARAM);
        tracker.record(new BatchResult("batch-3", false, List.of(),
                List.of(new FailedReplacement(risky, FailedReplacement.Reason.SAFETY_GATE, "below"),
                        new FailedReplacement(risky, FailedReplacement.Reason.SAFETY_GATE, "below")),
                false, List.of(), Map.of()));

        List<SafetyEvent> events = tracker.safetyEventsSince(NOW.minusSeconds(60));
        assertEquals(1, events.size());
        assertEquals(SafetyEvent.Kind.SAFETY_GATE, events.get(0).kind());
        assertEquals("batch-3: 2 replacement(s) below the safety threshold", events.get(0).detail());
    }

    @Test
    @DisplayName("an empty batch leaves the trend alone")
    void emptyBatchIgnored() {
        tracker.record(new BatchResult("batch-0", true, List.of(), List.of(), false, List.of(), Map.of()));

        assertTrue(tracker.trend().isEmpty());
    }

    @Test
    @DisplayName("unrelated payloads are ignored")
    void ignoresOtherPayloads() {
        eventBus.publish(new CampaignEvent(CampaignEvent.BATCH_COMPLETED, "x", Map.of("result", "nope"), NOW));

        assertEquals(0, tracker.totalAttempted());
    }
}
