package com.typewarden.core.analysis;

import java.time.Instant;

/**
 * A safety mechanism that fired: a rollback, a safety-gate rejection or an aborted batch.
 */
public record SafetyEvent(Instant timestamp, Kind kind, String detail) {
    public enum Kind { ROLLBACK, SAFETY_GATE, IO_ABORT }
}
