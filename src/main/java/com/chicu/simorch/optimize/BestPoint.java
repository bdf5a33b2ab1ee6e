package com.chicu.simorch.optimize;

import com.chicu.simorch.eval.EvaluationResult;

import java.util.Map;

public record BestPoint(
        double objective,
        Map<String, Double> params,
        EvaluationResult result
) {

    public static BestPoint none() {
        return new BestPoint(Double.POSITIVE_INFINITY, null, null);
    }
}
