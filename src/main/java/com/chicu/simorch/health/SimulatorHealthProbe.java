package com.chicu.simorch.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class SimulatorHealthProbe implements ApplicationRunner {

    private final SimulatorHealthService healthService;
    private final CapabilityReporter capabilityReporter;

    @Override
    public void run(ApplicationArguments args) {
        CapabilityDescriptor caps = capabilityReporter.schema();
        log.info("🧩 CAPABILITIES cache={} optimizer={} workers={} metrics={} tracking={}",
                caps.cacheBackend(), caps.optimizerStrategy(), caps.workerPoolSize(),
                caps.metricsBackend(), caps.trackingBackend());

        HealthStatus status = healthService.health();
        if (status.isHealthy()) {
            log.info("✅ plogic simulator OK: {}", status.detail());
        } else {
            // сервис поднимаем всё равно, health покажет проблему
            log.warn("⚠️ plogic simulator NOT available: {}", status.detail());
        }
    }
}
