package com.typewarden.core.monitor;

import java.time.Instant;

/**
 * One build probe.
 *
 * @param timestamp    when the probe finished
 * @param stable       whether the type checker passed
 * @param buildTimeMs  wall-clock duration of the check
 * @param errorCount   diagnostics reported, at least 1 for an unstable build
 * @param errorMessage first errors, truncated; {@code null} when stable
 */
public record BuildStabilityRecord(
    Instant timestamp,
    boolean stable,
    long buildTimeMs,
    int errorCount,
    String errorMessage
) {}
