package com.chicu.simorch.simulator.props;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "simorch.simulator")
public class SimulatorProperties {

    /**
     * Префикс команды симулятора, к нему дописываются аргументы подкоманды.
     * Пример: python3 -m plogic.cli
     */
    private List<String> executable = new ArrayList<>(List.of("python3", "-m", "plogic.cli"));

    /**
     * Каталог с исходниками симулятора. Добавляется в searchPathVariable,
     * только если реально существует.
     */
    private String sourceDir = "/app/external/photonic-logic/src";

    private String searchPathVariable = "PYTHONPATH";

    /**
     * Таймауты по стадиям (мс): introspection дешевле, cascade/objective дороже.
     */
    private long cascadeTimeoutMs = 60_000L;
    private long characterizeTimeoutMs = 30_000L;
    private long truthTableTimeoutMs = 45_000L;
    private long objectiveTimeoutMs = 60_000L;
    private long healthTimeoutMs = 5_000L;

    /**
     * 0 = min(4, cores)
     */
    private int workerPoolSize = 0;

    public Duration cascadeTimeout() {
        return Duration.ofMillis(Math.max(1, cascadeTimeoutMs));
    }

    public Duration characterizeTimeout() {
        return Duration.ofMillis(Math.max(1, characterizeTimeoutMs));
    }

    public Duration truthTableTimeout() {
        return Duration.ofMillis(Math.max(1, truthTableTimeoutMs));
    }

    public Duration objectiveTimeout() {
        return Duration.ofMillis(Math.max(1, objectiveTimeoutMs));
    }

    public Duration healthTimeout() {
        return Duration.ofMillis(Math.max(1, healthTimeoutMs));
    }

    public int effectiveWorkerPoolSize() {
        if (workerPoolSize > 0) return workerPoolSize;
        return Math.max(1, Math.min(4, Runtime.getRuntime().availableProcessors()));
    }
}
