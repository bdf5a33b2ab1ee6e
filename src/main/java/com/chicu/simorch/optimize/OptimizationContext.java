package com.chicu.simorch.optimize;

import java.time.Duration;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Всё, что нужно стратегии на один прогон.
 *
 * @param evaluator асинхронная оценка точки; future всегда завершается записью (ошибки уже свернуты)
 */
public record OptimizationContext(
        ParameterSpace space,
        int nCalls,
        int randomStarts,
        Random random,
        OptimizationState state,
        Duration objectiveTimeout,
        double failurePenalty,
        Function<Map<String, Double>, CompletableFuture<EvaluationRecord>> evaluator
) {
}
