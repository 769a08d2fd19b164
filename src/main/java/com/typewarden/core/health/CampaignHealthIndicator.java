package com.typewarden.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator view of {@link HealthCheckService}. Down if any component is down,
 * DEGRADED if any is degraded.
 */
@Component
public class CampaignHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public CampaignHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        var builder = Health.up();
        boolean anyDown = false;
        boolean anyDegraded = false;
        for (HealthStatus status : healthCheckService.checkAll()) {
            builder.withDetail(status.component(), status.status() + ": " + status.detail());
            anyDown |= status.status() == HealthStatus.Status.DOWN;
            anyDegraded |= status.status() == HealthStatus.Status.DEGRADED;
        }
        if (anyDown) {
            return builder.down().build();
        }
        return anyDegraded ? builder.status("DEGRADED").build() : builder.build();
    }
}
