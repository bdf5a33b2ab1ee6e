package com.chicu.simorch.optimize;

import com.chicu.simorch.eval.MetricExtractor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * objective = ber - weight * margin (меньше = лучше).
 * Нет метрики -> худший случай: ber = 1.0, margin = 0.0.
 */
@Component
public class ObjectivePolicy {

    public static final double DEFAULT_BER = 1.0;
    public static final double DEFAULT_MARGIN = 0.0;

    public double objective(Map<String, Double> metrics, double marginWeight) {
        double ber = value(metrics, MetricExtractor.BER_ESTIMATE, DEFAULT_BER);
        double margin = value(metrics, MetricExtractor.LOGIC_MARGIN, DEFAULT_MARGIN);
        return ber - marginWeight * margin;
    }

    private static double value(Map<String, Double> metrics, String name, double def) {
        if (metrics == null) return def;
        Double v = metrics.get(name);
        return v != null ? v : def;
    }
}
