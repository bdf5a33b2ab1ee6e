package com.chicu.simorch.optimize;

import com.chicu.simorch.eval.EvaluationParams;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Итог bo_run. trace здесь урезан до последних записей, полный trace уходит только на диск.
 */
@Builder
public record OptimizationRun(
        String runId,
        Instant timestamp,
        String strategy,
        List<ParameterDimension> space,
        EvaluationParams fixedParams,
        double objectiveMarginWeight,
        BestPoint best,
        long traceCount,
        List<EvaluationRecord> trace
) {
}
