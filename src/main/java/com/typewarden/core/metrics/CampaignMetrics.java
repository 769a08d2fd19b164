package com.typewarden.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the type-narrowing campaign.
 */
@Service
public class CampaignMetrics {

    private final MeterRegistry registry;

    public CampaignMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordClassification(String category, boolean intentional) {
        Counter.builder("typewarden.classifications.total")
                .tag("category", category)
                .tag("intentional", String.valueOf(intentional))
                .register(registry)
                .increment();
    }

    /**
     * Records the outcome of one replacement transaction.
     *
     * @param outcome "committed", "rolled_back" or "no_op"
     * @param ms      wall-clock time of the whole transaction
     */
    public void recordBatch(String outcome, int appliedCount, long ms) {
        Timer.builder("typewarden.batch.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));

        DistributionSummary.builder("typewarden.batch.applied")
                .description("Replacements committed per batch")
                .register(registry)
                .record(appliedCount);
    }

    public void recordRejection(String reason) {
        Counter.builder("typewarden.replacements.rejected")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordRollback(int fileCount) {
        Counter.builder("typewarden.rollbacks.total")
                .register(registry)
                .increment();

        DistributionSummary.builder("typewarden.rollbacks.files")
                .description("Files restored per rollback")
                .register(registry)
                .record(fileCount);
    }

    public void recordTypeCheck(boolean passed, boolean timedOut, long ms) {
        Timer.builder("typewarden.typecheck.duration")
                .tag("result", timedOut ? "timeout" : passed ? "passed" : "failed")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordAlert(String type, String severity) {
        Counter.builder("typewarden.alerts.total")
                .tag("type", type)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordSuppressedAlert(String type) {
        Counter.builder("typewarden.alerts.suppressed")
                .description("Alerts dropped by the de-duplication window")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    public void recordMonitorTick(boolean skipped) {
        Counter.builder("typewarden.monitor.ticks")
                .tag("skipped", String.valueOf(skipped))
                .register(registry)
                .increment();
    }

    public void recordBackupCleanup(int deleted) {
        Counter.builder("typewarden.backups.deleted")
                .register(registry)
                .increment(deleted);
    }
}
