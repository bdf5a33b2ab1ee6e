package com.chicu.simorch.optimize;

import com.chicu.simorch.eval.Threshold;
import com.chicu.simorch.eval.XpmMode;
import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Builder;

import java.util.List;
import java.util.Map;

@Builder
public record OptimizationRequest(
        Integer nCalls,
        Threshold threshold,
        @JsonAlias("mode") XpmMode xpmMode,

        // {"beta": [20, 40]} поверх пространства по умолчанию
        Map<String, List<Double>> spaceBounds,

        // фиксированные параметры cascade (threshold/xpm_mode здесь перекрывают поля запроса)
        Map<String, Object> fixedParams,

        Double objectiveMarginWeight,
        Integer randomStarts,
        Long seed
) {

    public static final int DEFAULT_N_CALLS = 40;
    public static final double DEFAULT_MARGIN_WEIGHT = 0.1;
    public static final int DEFAULT_RANDOM_STARTS = 8;

    public OptimizationRequest {
        if (nCalls == null) nCalls = DEFAULT_N_CALLS;
        if (threshold == null) threshold = Threshold.SOFT;
        if (xpmMode == null) xpmMode = XpmMode.PHYSICS;
        if (objectiveMarginWeight == null) objectiveMarginWeight = DEFAULT_MARGIN_WEIGHT;
        if (randomStarts == null) randomStarts = DEFAULT_RANDOM_STARTS;
        spaceBounds = spaceBounds == null ? Map.of() : Map.copyOf(spaceBounds);
        fixedParams = fixedParams == null ? Map.of() : Map.copyOf(fixedParams);
    }
}
