package com.chicu.simorch.optimize;

import com.chicu.simorch.eval.EvaluationParams;
import com.chicu.simorch.optimize.props.OptimizerProperties;
import com.chicu.simorch.optimize.strategy.ModelBasedStrategy;
import com.chicu.simorch.optimize.strategy.OptimizationStrategy;
import com.chicu.simorch.optimize.strategy.RandomSearchStrategy;
import com.chicu.simorch.persistence.ResultsStore;
import com.chicu.simorch.simulator.props.SimulatorProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

/**
 * bo_run: поиск минимума objective = ber - weight * margin по пространству параметров cascade.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OptimizationDriver {

    private final ObjectiveEvaluationService objectiveService;
    private final ModelBasedStrategy modelBased;
    private final RandomSearchStrategy randomSearch;
    private final OptimizerProperties props;
    private final SimulatorProperties simulatorProps;
    private final ResultsStore resultsStore;
    private final ObjectMapper objectMapper;

    @PostConstruct
    void validateConfig() {
        // бросит IllegalArgumentException на кривых trace-cap / trace-trim-to
        new TraceBuffer(props.getTraceCap(), props.getTraceTrimTo());
        if (props.getTransportTraceLimit() < 0 || !Double.isFinite(props.getFailurePenalty())) {
            throw new IllegalArgumentException("simorch.optimizer: transport-trace-limit >= 0 и конечный failure-penalty");
        }
    }

    public OptimizationRun optimize(OptimizationRequest request) {

        // ==========================
        // ✅ Валидация
        // ==========================
        if (request == null) {
            throw new IllegalArgumentException("request is null");
        }
        if (request.nCalls() < 1) {
            throw new IllegalArgumentException("n_calls должен быть >= 1, получено: " + request.nCalls());
        }
        if (!Double.isFinite(request.objectiveMarginWeight())) {
            throw new IllegalArgumentException("objective_margin_weight должен быть конечным");
        }
        if (request.randomStarts() < 1) {
            throw new IllegalArgumentException("random_starts должен быть >= 1");
        }

        ParameterSpace space = ParameterSpace.defaults().withBounds(request.spaceBounds());
        for (String name : space.names()) {
            if (!EvaluationParams.isTunable(name)) {
                throw new IllegalArgumentException("параметр не настраивается: " + name);
            }
        }

        EvaluationParams fixed = fixedParams(request);
        double weight = request.objectiveMarginWeight();
        double penalty = props.getFailurePenalty();
        Duration timeout = simulatorProps.objectiveTimeout();

        OptimizationState state = new OptimizationState(props.getTraceCap(), props.getTraceTrimTo());
        Random random = request.seed() != null ? new Random(request.seed()) : new Random();

        OptimizationContext ctx = new OptimizationContext(
                space,
                request.nCalls(),
                request.randomStarts(),
                random,
                state,
                timeout,
                penalty,
                point -> objectiveService.evaluateAsync(point, fixed, weight, penalty, timeout)
        );

        OptimizationStrategy strategy = select(space);
        String runId = UUID.randomUUID().toString();
        long started = System.currentTimeMillis();

        log.info("🧠 BO START run={} strategy={} nCalls={} dims={} threshold={} mode={}",
                runId, strategy.name(), request.nCalls(), space.names(),
                fixed.threshold().wire(), fixed.xpmMode().wire());

        strategy.run(ctx);

        BestPoint best = state.best();
        OptimizationRun run = OptimizationRun.builder()
                .runId(runId)
                .timestamp(Instant.now())
                .strategy(strategy.name())
                .space(space.dimensions())
                .fixedParams(fixed)
                .objectiveMarginWeight(weight)
                .best(best)
                .traceCount(state.evaluations())
                .trace(state.lastRecords(props.getTransportTraceLimit()))
                .build();

        log.info("✅ BO DONE run={} evals={} bestObjective={} bestParams={} tookMs={}",
                runId, run.traceCount(), best.objective(), best.params(), System.currentTimeMillis() - started);

        persist(run, state.trace());
        return run;
    }

    /**
     * Стратегия, которая реально будет использована (с учётом размерности).
     */
    public String strategyName(int dimension) {
        return useModel(dimension) ? modelBased.name() : randomSearch.name();
    }

    public String configuredStrategy() {
        return strategyName(ParameterSpace.defaults().size());
    }

    // =========================================================
    // helpers
    // =========================================================

    private OptimizationStrategy select(ParameterSpace space) {
        return useModel(space.size()) ? modelBased : randomSearch;
    }

    private boolean useModel(int dimension) {
        return props.getStrategy() == OptimizerProperties.Strategy.MODEL && modelBased.supports(dimension);
    }

    private EvaluationParams fixedParams(OptimizationRequest request) {
        Map<String, Object> merged = new LinkedHashMap<>();
        merged.put("threshold", request.threshold().wire());
        merged.put("xpm_mode", request.xpmMode().wire());
        merged.putAll(request.fixedParams());
        return objectMapper.convertValue(merged, EvaluationParams.class);
    }

    private void persist(OptimizationRun run, List<EvaluationRecord> fullTrace) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("payload", run);
        doc.put("trace_full", fullTrace);
        try {
            resultsStore.write("bo_run", run.runId(), doc);
        } catch (RuntimeException e) {
            log.error("❌ BO RUN NOT SAVED run={} : {}", run.runId(), e.getMessage(), e);
        }
    }
}
