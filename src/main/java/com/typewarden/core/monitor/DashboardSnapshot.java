package com.typewarden.core.monitor;

import com.typewarden.core.analysis.AnalysisReport;

import java.time.Instant;

/**
 * Everything the live dashboard shows, as of one monitor tick.
 */
public record DashboardSnapshot(
    Instant generatedAt,
    long tick,
    AnalysisReport analysis,
    BuildStabilitySummary buildStability,
    AlertSummary alerts,
    TrendingData trending,
    SystemHealth health
) {}
