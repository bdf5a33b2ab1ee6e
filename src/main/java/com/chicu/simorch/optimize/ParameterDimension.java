package com.chicu.simorch.optimize;

/**
 * Одно измерение пространства поиска.
 * Если диапазон покрывает больше чем x50 (low > 0), шкала логарифмическая.
 */
public record ParameterDimension(
        String name,
        double low,
        double high
) {

    static final double LOG_SCALE_RATIO = 50.0;

    public ParameterDimension {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("ParamSpace: name пустой");
        }
        if (!Double.isFinite(low) || !Double.isFinite(high)) {
            throw new IllegalArgumentException("ParamSpace: границы должны быть конечными для " + name);
        }
        if (low >= high) {
            throw new IllegalArgumentException("ParamSpace: low >= high для " + name);
        }
    }

    public boolean logScale() {
        return low > 0 && high / low > LOG_SCALE_RATIO;
    }

    /**
     * u из [0,1] -> значение в [low, high] с учётом шкалы.
     */
    public double fromUnit(double u) {
        double t = Math.max(0.0, Math.min(1.0, u));
        double v;
        if (logScale()) {
            double lo = Math.log(low);
            double hi = Math.log(high);
            v = Math.exp(lo + t * (hi - lo));
        } else {
            v = low + t * (high - low);
        }
        // exp/log может чуть вылезти за границы
        return Math.max(low, Math.min(high, v));
    }
}
