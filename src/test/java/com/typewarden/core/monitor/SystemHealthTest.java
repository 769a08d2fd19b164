package com.typewarden.core.monitor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SystemHealthTest {

    @Test
    @DisplayName("no alerts is a perfect score")
    void noAlerts() {
        assertEquals(new SystemHealth(100, SystemHealth.Level.HEALTHY), SystemHealth.compute(0, 0, 0));
    }

    @Test
    @DisplayName("critical and high alerts weigh more than the rest")
    void weighted() {
        SystemHealth health = SystemHealth.compute(1, 1, 2);

        assertEquals(66, health.score());
        assertEquals(SystemHealth.Level.WARNING, health.level());
    }

    @Test
    @DisplayName("level boundaries")
    void boundaries() {
        assertEquals(SystemHealth.Level.HEALTHY, SystemHealth.compute(0, 0, 10).level());
        assertEquals(SystemHealth.Level.WARNING, SystemHealth.compute(2, 0, 0).level());
        assertEquals(SystemHealth.Level.CRITICAL, SystemHealth.compute(3, 0, 3).level());
    }

    @Test
    @DisplayName("score never drops below zero")
    void clamped() {
        assertEquals(0, SystemHealth.compute(10, 10, 20).score());
    }
}
