package com.chicu.simorch.health;

import com.chicu.simorch.cache.ResultCache;
import com.chicu.simorch.config.SimulationExecutors;
import com.chicu.simorch.eval.SimulationMetrics;
import com.chicu.simorch.optimize.OptimizationDriver;
import com.chicu.simorch.tools.ToolRegistry;
import com.chicu.simorch.tracking.ExperimentTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * schema(): что сейчас включено. Без побочных эффектов.
 */
@Component
@RequiredArgsConstructor
public class CapabilityReporter {

    private final ResultCache cache;
    private final OptimizationDriver optimizationDriver;
    private final SimulationExecutors executors;
    private final SimulationMetrics metrics;
    private final ExperimentTracker tracker;

    // реестр сам ссылается на reporter через tool plogic_schema
    private final ObjectProvider<ToolRegistry> toolRegistry;

    public CapabilityDescriptor schema() {
        ToolRegistry registry = toolRegistry.getIfAvailable();
        List<String> operations = registry != null ? registry.names() : List.of();

        return CapabilityDescriptor.builder()
                .availableOperations(operations)
                .optimizerStrategy(optimizationDriver.configuredStrategy())
                .cacheBackend(cache.backendName())
                .workerPoolSize(executors.poolSize())
                .metricsBackend(metrics.backendName())
                .trackingBackend(tracker.backendName())
                .build();
    }
}
