package com.typewarden.core.replacer;

import java.time.Duration;

/**
 * Raw outcome of one type checker run.
 *
 * @param exitCode process exit status, {@code -1} when the process never ran or was killed
 * @param output   merged stdout and stderr
 * @param timedOut whether the run exceeded its time budget
 * @param elapsed  wall-clock duration
 */
public record TypeCheckResult(
    int exitCode,
    String output,
    boolean timedOut,
    Duration elapsed
) {
    public boolean passed() {
        return !timedOut && exitCode == 0;
    }

    public static TypeCheckResult timedOut(String partialOutput, Duration elapsed) {
        return new TypeCheckResult(-1, partialOutput != null ? partialOutput : "", true, elapsed);
    }

    public static TypeCheckResult failedToStart(String reason, Duration elapsed) {
        return new TypeCheckResult(-1, "Type checker could not be started: " + reason, false, elapsed);
    }
}
