package com.typewarden.core.monitor;

/**
 * Overall campaign health derived from recent alerts.
 *
 * @param score 0 to 100
 * @param level bucket of {@code score}
 */
public record SystemHealth(int score, Level level) {

    public enum Level {
        HEALTHY,
        WARNING,
        CRITICAL
    }

    static final int CRITICAL_PENALTY = 20;
    static final int HIGH_PENALTY = 10;
    static final int PER_ALERT_PENALTY = 2;

    public static SystemHealth compute(AlertSummary summary) {
        return compute(summary.critical(), summary.high(), summary.total());
    }

    public static SystemHealth compute(int critical, int high, int total) {
        int raw = 100 - CRITICAL_PENALTY * critical - HIGH_PENALTY * high - PER_ALERT_PENALTY * total;
        int score = Math.max(0, Math.min(100, raw));
        Level level = score >= 80 ? Level.HEALTHY : score >= 60 ? Level.WARNING : Level.CRITICAL;
        return new SystemHealth(score, level);
    }
}
