package com.typewarden.core.monitor;

import com.typewarden.core.analysis.AccuracyReport;
import com.typewarden.core.analysis.AnalysisReport;
import com.typewarden.core.analysis.ReplacementOutcomeTracker;
import com.typewarden.core.analysis.SafetyEvent;
import com.typewarden.core.analysis.SuccessRateReport;
import com.typewarden.core.config.CampaignProperties;
import com.typewarden.core.engine.CampaignLock;
import com.typewarden.core.events.CampaignEvent;
import com.typewarden.core.events.EventBus;
import com.typewarden.core.logging.MdcContext;
import com.typewarden.core.metrics.CampaignMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically probes the build, evaluates alert thresholds and publishes a
 * {@link DashboardSnapshot}.
 * <p>
 * Ticks run on a single daemon thread and at most one at a time; a tick that
 * fires while the previous one is still running is skipped. The probe runs under
 * the {@link CampaignLock}, so it never sees a batch half-applied. Once stopped,
 * the monitor emits nothing further.
 */
@Service
public class ProgressMonitor {

    private static final Logger log = LoggerFactory.getLogger(ProgressMonitor.class);

    static final Duration SAFETY_EVENT_WINDOW = Duration.ofHours(24);

    public enum State {
        IDLE,
        RUNNING,
        STOPPED
    }

    private record TickInput(BuildStabilityRecord probe, AnalysisReport report) {}

    private final CampaignProperties.Monitor settings;
    private final BuildStabilityProbe probe;
    private final BuildStabilityHistory buildHistory;
    private final AlertHistory alertHistory;
    private final AnalysisReportSource reportSource;
    private final ReplacementOutcomeTracker outcomes;
    private final CampaignLock lock;
    private final EventBus eventBus;
    private final CampaignMetrics metrics;
    private final Clock clock;

    private final AtomicBoolean ticking = new AtomicBoolean(false);
    private final AtomicLong tickCounter = new AtomicLong();
    private volatile State state = State.IDLE;
    private volatile DashboardSnapshot latestSnapshot;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;

    public ProgressMonitor(CampaignProperties properties,
                           BuildStabilityProbe probe,
                           BuildStabilityHistory buildHistory,
                           AlertHistory alertHistory,
                           AnalysisReportSource reportSource,
                           ReplacementOutcomeTracker outcomes,
                           CampaignLock lock,
                           EventBus eventBus,
                           CampaignMetrics metrics,
                           Clock clock) {
        this.settings = properties.getMonitor();
        this.probe = probe;
        this.buildHistory = buildHistory;
        this.alertHistory = alertHistory;
        this.reportSource = reportSource;
        this.outcomes = outcomes;
        this.lock = lock;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    @PostConstruct
    void autoStart() {
        if (settings.isAutoStart()) {
            start();
        }
    }

    public synchronized void start() {
        if (state == State.RUNNING) {
            return;
        }
        long interval = settings.getIntervalSeconds();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "campaign-monitor");
            t.setDaemon(true);
            return t;
        });
        task = scheduler.scheduleAtFixedRate(this::scheduledTick, 0, interval, TimeUnit.SECONDS);
        state = State.RUNNING;
        log.info("Campaign monitor started (interval={}s)", interval);
    }

    @PreDestroy
    public synchronized void stop() {
        if (state == State.STOPPED) {
            return;
        }
        state = State.STOPPED;
        if (task != null) {
            task.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Campaign monitor stopped after {} ticks", tickCounter.get());
    }

    public State getState() {
        return state;
    }

    public Optional<DashboardSnapshot> latestSnapshot() {
        return Optional.ofNullable(latestSnapshot);
    }

    private void scheduledTick() {
        // an exception escaping here would cancel the periodic task
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Unexpected failure in monitor tick", e);
        }
    }

    /**
     * Runs one monitoring cycle.
     *
     * @return the new snapshot, or empty if the tick was skipped, failed, or the monitor is stopped
     */
    public Optional<DashboardSnapshot> tick() {
        if (state == State.STOPPED) {
            return Optional.empty();
        }
        if (!ticking.compareAndSet(false, true)) {
            log.debug("Previous monitor tick still running, skipping");
            metrics.recordMonitorTick(true);
            return Optional.empty();
        }
        long tickNumber = tickCounter.incrementAndGet();
        MdcContext.setMonitorTick(tickNumber);
        try {
            TickInput input = lock.runExclusive("monitor-tick-" + tickNumber, () -> {
                BuildStabilityRecord record = probe.probe();
                buildHistory.record(record);
                return new TickInput(record, reportSource.currentReport());
            });
            evaluateAlerts(input.report());
            DashboardSnapshot snapshot = snapshot(tickNumber, input.report());
            latestSnapshot = snapshot;
            if (state != State.STOPPED) {
                eventBus.publish(new CampaignEvent(CampaignEvent.DASHBOARD_UPDATED, "monitor-tick-" + tickNumber,
                        Map.of("snapshot", snapshot), snapshot.generatedAt()));
            }
            log.debug("Monitor tick {} complete: health {} ({})", tickNumber,
                    snapshot.health().score(), snapshot.health().level());
            return Optional.of(snapshot);
        } catch (RuntimeException e) {
            log.error("Monitor tick {} failed: {}", tickNumber, e.getMessage(), e);
            emit(AlertType.SYSTEM_ERROR, AlertSeverity.HIGH,
                    "Monitoring tick failed: " + e.getMessage(),
                    Map.of("exception", e.getClass().getName()));
            return Optional.empty();
        } finally {
            metrics.recordMonitorTick(false);
            ticking.set(false);
            MdcContext.clear();
        }
    }

    /**
     * Checks every threshold against the given report and the monitor's own histories.
     *
     * @return the alerts actually raised, duplicates within the dedup window excluded
     */
    public List<Alert> evaluateAlerts(AnalysisReport report) {
        var raised = new ArrayList<Alert>();

        SuccessRateReport successRates = report.successRates();
        if (successRates.totalAttempted() > 0
                && successRates.currentSuccessRate() < settings.getSuccessRateThreshold()) {
            emit(AlertType.LOW_SUCCESS_RATE, AlertSeverity.MEDIUM,
                    String.format(Locale.ROOT, "Success rate %.1f%% is below the %.1f%% threshold",
                            successRates.currentSuccessRate(), settings.getSuccessRateThreshold()),
                    Map.of("successRate", successRates.currentSuccessRate(),
                            "threshold", settings.getSuccessRateThreshold()))
                    .ifPresent(raised::add);
        }

        AccuracyReport accuracy = report.accuracy();
        if (accuracy.sampleSize() > 0
                && accuracy.overallAccuracy() < settings.getClassificationAccuracyThreshold()) {
            emit(AlertType.LOW_CLASSIFICATION_ACCURACY, AlertSeverity.MEDIUM,
                    String.format(Locale.ROOT, "Classification accuracy %.1f%% is below the %.1f%% threshold",
                            accuracy.overallAccuracy(), settings.getClassificationAccuracyThreshold()),
                    Map.of("accuracy", accuracy.overallAccuracy(),
                            "threshold", settings.getClassificationAccuracyThreshold(),
                            "sampleSize", accuracy.sampleSize()))
                    .ifPresent(raised::add);
        }

        Instant now = clock.instant();
        Duration sinceProgress = Duration.between(outcomes.lastProgressAt(), now);
        if (sinceProgress.compareTo(Duration.ofHours(settings.getProgressStallHours())) > 0) {
            emit(AlertType.PROGRESS_STALL, AlertSeverity.MEDIUM,
                    "No replacement progress for " + sinceProgress.toHours() + " hours",
                    Map.of("hoursSinceProgress", sinceProgress.toHours(),
                            "threshold", settings.getProgressStallHours()))
                    .ifPresent(raised::add);
        }

        List<SafetyEvent> safetyEvents = outcomes.safetyEventsSince(now.minus(SAFETY_EVENT_WINDOW));
        if (safetyEvents.size() >= settings.getSafetyEventThreshold()) {
            emit(AlertType.FREQUENT_SAFETY_EVENTS, AlertSeverity.HIGH,
                    safetyEvents.size() + " safety events in the last 24 hours",
                    Map.of("eventCount", safetyEvents.size(), "threshold", settings.getSafetyEventThreshold()))
                    .ifPresent(raised::add);
        }

        BuildStabilityRecord latest = buildHistory.latest();
        if (latest != null && !latest.stable()) {
            emit(AlertType.BUILD_FAILURE, AlertSeverity.HIGH,
                    "Build failed with " + latest.errorCount() + " error(s)",
                    Map.of("errorCount", latest.errorCount(),
                            "errorMessage", latest.errorMessage() != null ? latest.errorMessage() : ""))
                    .ifPresent(raised::add);
        }

        int failures = buildHistory.consecutiveFailures();
        if (failures >= settings.getBuildFailureThreshold()) {
            emit(AlertType.CONSECUTIVE_BUILD_FAILURES, AlertSeverity.CRITICAL,
                    failures + " consecutive build failures detected",
                    Map.of("failureCount", failures, "threshold", settings.getBuildFailureThreshold()))
                    .ifPresent(raised::add);
        }

        return raised;
    }

    private Optional<Alert> emit(AlertType type, AlertSeverity severity, String message, Map<String, Object> data) {
        if (state == State.STOPPED) {
            return Optional.empty();
        }
        Optional<Alert> recorded = alertHistory.record(new Alert(type, severity, message, clock.instant(), data));
        if (recorded.isEmpty()) {
            metrics.recordSuppressedAlert(type.key());
            return recorded;
        }
        Alert alert = recorded.get();
        log.warn("Alert raised [{}] {}: {}", severity, type.key(), message);
        metrics.recordAlert(type.key(), severity.name());
        eventBus.publish(new CampaignEvent(CampaignEvent.ALERT_RAISED, "monitor",
                Map.of("alert", alert), alert.timestamp()));
        return recorded;
    }

    private DashboardSnapshot snapshot(long tickNumber, AnalysisReport report) {
        AlertSummary alerts = alertHistory.summary();
        return new DashboardSnapshot(
                clock.instant(),
                tickNumber,
                report,
                buildHistory.summary(),
                alerts,
                trending(report),
                SystemHealth.compute(alerts));
    }

    private TrendingData trending(AnalysisReport report) {
        List<TrendPoint> successRate = report.successRates().trend().stream()
                .map(p -> new TrendPoint(p.timestamp(), p.successRate()))
                .toList();
        List<BuildStabilityRecord> builds = buildHistory.snapshot();
        List<TrendPoint> buildTimes = builds.stream()
                .map(b -> new TrendPoint(b.timestamp(), b.buildTimeMs()))
                .toList();
        List<TrendPoint> buildErrors = builds.stream()
                .map(b -> new TrendPoint(b.timestamp(), b.errorCount()))
                .toList();
        return new TrendingData(successRate, buildTimes, buildErrors);
    }
}
