package com.typewarden.core.health;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CampaignHealthIndicatorTest {

    private final HealthCheckService service = mock(HealthCheckService.class);
    private final CampaignHealthIndicator indicator = new CampaignHealthIndicator(service);

    private static HealthStatus status(String component, HealthStatus.Status status) {
        return new HealthStatus(component, status, "detail", Map.of());
    }

    @Test
    @DisplayName("All components UP -> UP")
    void allUp() {
        when(service.checkAll()).thenReturn(List.of(status("backups", HealthStatus.Status.UP),
                status("build", HealthStatus.Status.UP)));

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("UP: detail", health.getDetails().get("backups"));
    }

    @Test
    @DisplayName("Any component DEGRADED -> DEGRADED")
    void degraded() {
        when(service.checkAll()).thenReturn(List.of(status("backups", HealthStatus.Status.UP),
                status("monitor", HealthStatus.Status.DEGRADED)));

        assertEquals("DEGRADED", indicator.health().getStatus().getCode());
    }

    @Test
    @DisplayName("Any component DOWN -> DOWN")
    void down() {
        when(service.checkAll()).thenReturn(List.of(status("monitor", HealthStatus.Status.DEGRADED),
                status("build", HealthStatus.Status.DOWN)));

        assertEquals(Status.DOWN, indicator.health().getStatus());
    }
}
