package com.chicu.simorch.optimize;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public record ParameterSpace(List<ParameterDimension> dimensions) {

    public ParameterSpace {
        if (dimensions == null || dimensions.isEmpty()) {
            throw new IllegalArgumentException("ParamSpace: пустое пространство");
        }
        Set<String> seen = new HashSet<>();
        for (ParameterDimension d : dimensions) {
            if (d == null) throw new IllegalArgumentException("ParamSpace: dimension is null");
            if (!seen.add(d.name())) {
                throw new IllegalArgumentException("ParamSpace: дубль имени " + d.name());
            }
        }
        dimensions = List.copyOf(dimensions);
    }

    /**
     * Пространство по умолчанию для cascade.
     */
    public static ParameterSpace defaults() {
        return new ParameterSpace(List.of(
                new ParameterDimension("n2", 1e-18, 1e-16),
                new ParameterDimension("a_eff", 0.1e-12, 2e-12),
                new ParameterDimension("n_eff", 1.4, 3.5),
                new ParameterDimension("g_geom", 0.5, 1.0),
                new ParameterDimension("beta", 10.0, 100.0)
        ));
    }

    /**
     * Переопределение границ по имени: {"beta": [20, 40]}. Неизвестное имя = ошибка.
     */
    public ParameterSpace withBounds(Map<String, List<Double>> bounds) {
        if (bounds == null || bounds.isEmpty()) return this;

        Set<String> names = new HashSet<>(names());
        for (String key : bounds.keySet()) {
            if (!names.contains(key)) {
                throw new IllegalArgumentException("ParamSpace: неизвестный параметр " + key + ", допустимы " + names());
            }
        }

        List<ParameterDimension> out = new ArrayList<>(dimensions.size());
        for (ParameterDimension d : dimensions) {
            List<Double> b = bounds.get(d.name());
            if (b == null) {
                out.add(d);
                continue;
            }
            if (b.size() != 2 || b.get(0) == null || b.get(1) == null) {
                throw new IllegalArgumentException("ParamSpace: для " + d.name() + " нужно ровно [low, high]");
            }
            out.add(new ParameterDimension(d.name(), b.get(0), b.get(1)));
        }
        return new ParameterSpace(out);
    }

    public int size() {
        return dimensions.size();
    }

    public List<String> names() {
        return dimensions.stream().map(ParameterDimension::name).toList();
    }

    /**
     * Точка оптимизатора в единичном кубе -> именованные параметры, порядок = порядок измерений.
     */
    public Map<String, Double> fromUnit(double[] unitPoint) {
        if (unitPoint == null || unitPoint.length != dimensions.size()) {
            throw new IllegalArgumentException("point dimension mismatch: expected " + dimensions.size());
        }
        Map<String, Double> out = new LinkedHashMap<>();
        for (int i = 0; i < dimensions.size(); i++) {
            ParameterDimension d = dimensions.get(i);
            out.put(d.name(), d.fromUnit(unitPoint[i]));
        }
        return out;
    }
}
