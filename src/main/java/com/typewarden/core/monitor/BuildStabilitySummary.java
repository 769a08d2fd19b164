package com.typewarden.core.monitor;

public record BuildStabilitySummary(
    BuildStabilityRecord latest,
    int consecutiveFailures,
    double stabilityRate,
    double averageBuildTimeMs,
    int sampleCount
) {}
