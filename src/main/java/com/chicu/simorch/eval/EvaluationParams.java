package com.chicu.simorch.eval;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Builder;

import java.util.List;

/**
 * Параметры одного прогона cascade. null в опциональных полях = флаг не передаётся.
 */
@Builder(toBuilder = true)
public record EvaluationParams(
        Threshold threshold,
        Double beta,
        @JsonAlias("mode") XpmMode xpmMode,

        // опциональные физические параметры
        Double n2,
        Double aEff,
        Double nEff,
        Double gGeom,

        // свободные флаги, до симулятора доходят только прошедшие ArgumentSanitizer
        List<String> extra
) {

    public static final double DEFAULT_BETA = 30.0;
    public static final double DEFAULT_N2 = 1e-17;

    public EvaluationParams {
        if (threshold == null) threshold = Threshold.SOFT;
        if (xpmMode == null) xpmMode = XpmMode.PHYSICS;
        if (beta == null) beta = DEFAULT_BETA;
        if (!Double.isFinite(beta) || beta <= 0) {
            throw new IllegalArgumentException("beta должен быть > 0, получено: " + beta);
        }
        extra = extra == null ? List.of() : List.copyOf(extra);
    }

    public EvaluationParams withExtra(List<String> newExtra) {
        return toBuilder().extra(newExtra).build();
    }

    /**
     * Значение по имени параметра пространства оптимизации (beta, n2, a_eff, n_eff, g_geom).
     */
    public EvaluationParams with(String name, double value) {
        return switch (name) {
            case "beta" -> toBuilder().beta(value).build();
            case "n2" -> toBuilder().n2(value).build();
            case "a_eff" -> toBuilder().aEff(value).build();
            case "n_eff" -> toBuilder().nEff(value).build();
            case "g_geom" -> toBuilder().gGeom(value).build();
            default -> throw new IllegalArgumentException("Неизвестный параметр пространства: " + name);
        };
    }

    public static boolean isTunable(String name) {
        return switch (name) {
            case "beta", "n2", "a_eff", "n_eff", "g_geom" -> true;
            default -> false;
        };
    }
}
