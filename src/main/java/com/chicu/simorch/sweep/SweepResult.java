package com.chicu.simorch.sweep;

import com.chicu.simorch.eval.EvaluationResult;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * countOk + countError == размер запроса; порядок внутри каждого списка = порядок входа.
 */
@Builder
public record SweepResult(
        String runId,
        Instant timestamp,
        int countOk,
        int countError,
        List<EvaluationResult> results,
        List<SweepError> errors
) {
    public SweepResult {
        results = results == null ? List.of() : List.copyOf(results);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
