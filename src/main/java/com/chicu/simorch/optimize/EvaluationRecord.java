package com.chicu.simorch.optimize;

import com.chicu.simorch.common.error.ErrorKind;
import com.chicu.simorch.eval.EvaluationResult;
import lombok.Builder;

import java.util.Map;

@Builder
public record EvaluationRecord(
        Map<String, Double> params,
        double objective,
        Map<String, Double> metrics,
        EvaluationResult result,

        // заполнены только у неудачной точки
        String error,
        ErrorKind errorKind
) {

    public EvaluationRecord {
        params = params == null ? Map.of() : Map.copyOf(params);
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    public boolean failed() {
        return error != null;
    }

    public static EvaluationRecord ok(Map<String, Double> params, double objective, EvaluationResult result) {
        return EvaluationRecord.builder()
                .params(params)
                .objective(objective)
                .metrics(result.metrics())
                .result(result)
                .build();
    }

    public static EvaluationRecord failed(Map<String, Double> params, double penalty, Throwable error) {
        Throwable cause = ErrorKind.unwrap(error);
        String msg = cause.getMessage();
        return EvaluationRecord.builder()
                .params(params)
                .objective(penalty)
                .error(msg == null || msg.isBlank() ? cause.getClass().getSimpleName() : msg)
                .errorKind(ErrorKind.of(cause))
                .build();
    }
}
