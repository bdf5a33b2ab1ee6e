package com.chicu.simorch.optimize;

import com.chicu.simorch.config.SimulationExecutors;
import com.chicu.simorch.eval.EvaluationParams;
import com.chicu.simorch.eval.EvaluationService;
import com.chicu.simorch.eval.SimulationMetrics;
import com.chicu.simorch.tracking.ExperimentTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Точка пространства + фиксированные параметры -> cascade -> objective.
 * Ошибки не пробрасываются: future завершается записью со штрафом.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ObjectiveEvaluationService {

    private final EvaluationService evaluationService;
    private final ObjectivePolicy policy;
    private final SimulationMetrics metrics;
    private final ExperimentTracker tracker;
    private final SimulationExecutors executors;

    public CompletableFuture<EvaluationRecord> evaluateAsync(Map<String, Double> point,
                                                             EvaluationParams fixed,
                                                             double marginWeight,
                                                             double failurePenalty,
                                                             Duration timeout) {
        EvaluationParams params;
        try {
            params = apply(fixed, point);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(EvaluationRecord.failed(point, failurePenalty, e));
        }

        return evaluationService.evaluateAsync(params, timeout)
                .handle((result, error) -> {
                    if (error != null) {
                        EvaluationRecord failed = EvaluationRecord.failed(point, failurePenalty, error);
                        log.debug("🎯 OBJECTIVE FAILED point={} kind={} : {}", point, failed.errorKind(), failed.error());
                        return failed;
                    }
                    double objective = policy.objective(result.metrics(), marginWeight);
                    metrics.objective(objective);
                    track(point, marginWeight, result.metrics(), objective);
                    return EvaluationRecord.ok(point, objective, result);
                });
    }

    private void track(Map<String, Double> point, double marginWeight, Map<String, Double> measured, double objective) {
        Map<String, Object> params = new LinkedHashMap<>(point);
        params.put("objective_margin_weight", marginWeight);
        Map<String, Double> values = new LinkedHashMap<>(measured);
        values.put("objective", objective);
        CompletableFuture
                .runAsync(() -> tracker.logRun(params, values), executors.workers())
                .exceptionally(e -> {
                    log.debug("tracking skipped: {}", e.getMessage());
                    return null;
                });
    }

    static EvaluationParams apply(EvaluationParams fixed, Map<String, Double> point) {
        EvaluationParams p = fixed;
        for (Map.Entry<String, Double> e : point.entrySet()) {
            p = p.with(e.getKey(), e.getValue());
        }
        return p;
    }
}
