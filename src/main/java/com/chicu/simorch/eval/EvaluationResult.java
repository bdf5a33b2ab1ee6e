package com.chicu.simorch.eval;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Результат cascade. Из кэша отдаётся десериализованная копия с тем же runId.
 */
@Builder
public record EvaluationResult(
        String runId,
        Instant timestamp,
        EvaluationParams params,

        // JSON симулятора или {"raw": "..."}
        JsonNode rawOutput,

        Map<String, Double> metrics,
        double durationSeconds
) {

    public EvaluationResult {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    public Optional<Double> metric(String name) {
        return Optional.ofNullable(metrics.get(name));
    }
}
