package com.chicu.simorch.health;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("simulator")
@RequiredArgsConstructor
public class SimulatorHealthIndicator implements HealthIndicator {

    private final SimulatorHealthService healthService;

    @Override
    public Health health() {
        HealthStatus status = healthService.health();
        Health.Builder b = status.isHealthy() ? Health.up() : Health.down();
        return b.withDetail("status", status.status())
                .withDetail("detail", status.detail())
                .build();
    }
}
