package com.chicu.simorch.eval;

import com.chicu.simorch.common.error.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-метрики оркестратора. Без MeterRegistry всё превращается в no-op.
 */
@Component
public class SimulationMetrics {

    private final MeterRegistry registry; // may be null (fail-soft)

    private final Counter runs;
    private final Timer duration;
    private final DistributionSummary objective;
    private final Map<String, Counter> errors = new ConcurrentHashMap<>();
    private final Map<String, Counter> cacheLookups = new ConcurrentHashMap<>();

    @Autowired
    public SimulationMetrics(ObjectProvider<MeterRegistry> registryProvider) {
        this(registryProvider.getIfAvailable());
    }

    public SimulationMetrics(MeterRegistry registry) {
        this.registry = registry;
        if (registry == null) {
            this.runs = null;
            this.duration = null;
            this.objective = null;
            return;
        }
        this.runs = Counter.builder("plogic.cascade.total")
                .description("Total cascade runs")
                .register(registry);
        this.duration = Timer.builder("plogic.cascade.duration")
                .description("Cascade duration")
                .register(registry);
        this.objective = DistributionSummary.builder("plogic.bo.objective")
                .description("Objective values (ber - alpha*margin)")
                .register(registry);
        Gauge.builder("plogic.threads", Thread::activeCount)
                .description("Live JVM threads")
                .register(registry);
    }

    public void cascadeRun(Duration took) {
        if (registry == null) return;
        runs.increment();
        duration.record(took);
    }

    public void error(ErrorKind kind) {
        if (registry == null || kind == null) return;
        String tag = kind.name().toLowerCase(Locale.ROOT);
        errors.computeIfAbsent(tag, k -> Counter.builder("plogic.cascade.errors")
                        .tag("kind", k)
                        .register(registry))
                .increment();
    }

    public void cacheLookup(boolean hit) {
        if (registry == null) return;
        String tag = hit ? "hit" : "miss";
        cacheLookups.computeIfAbsent(tag, k -> Counter.builder("plogic.cache.lookups")
                        .tag("result", k)
                        .register(registry))
                .increment();
    }

    public void objective(double value) {
        if (registry == null || !Double.isFinite(value)) return;
        objective.record(value);
    }

    public String backendName() {
        return registry == null ? "disabled" : registry.getClass().getSimpleName();
    }
}
