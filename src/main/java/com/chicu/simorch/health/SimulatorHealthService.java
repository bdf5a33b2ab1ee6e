package com.chicu.simorch.health;

import com.chicu.simorch.common.error.ErrorKind;
import com.chicu.simorch.config.SimulationExecutors;
import com.chicu.simorch.simulator.ProcessOutcome;
import com.chicu.simorch.simulator.SimulatorProcessRunner;
import com.chicu.simorch.simulator.props.SimulatorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Проверка доступности симулятора через `--help` с коротким таймаутом.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SimulatorHealthService {

    static final int DETAIL_LIMIT = 300;

    private final SimulatorProcessRunner processRunner;
    private final SimulatorProperties props;
    private final SimulationExecutors executors;

    public HealthStatus health() {
        try {
            // процесс, как и все остальные запуски симулятора, только на worker-потоке
            ProcessOutcome outcome = CompletableFuture
                    .supplyAsync(() -> processRunner.run(List.of("--help"), props.healthTimeout()), executors.workers())
                    .join();
            if (outcome.ok()) {
                return HealthStatus.healthy("plogic CLI reachable");
            }
            return HealthStatus.unhealthy(limit(outcome.stderr()));
        } catch (Exception e) {
            Throwable cause = ErrorKind.unwrap(e);
            log.debug("health probe failed: {}", cause.getMessage());
            return HealthStatus.unhealthy(limit(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()));
        }
    }

    private static String limit(String s) {
        if (s == null) return "";
        return s.length() > DETAIL_LIMIT ? s.substring(0, DETAIL_LIMIT) : s;
    }
}
