package com.chicu.simorch.optimize;

/**
 * Синхронная целевая функция для оптимизатора, который сам блокирует свой поток.
 * Реализация не должна бросать исключения.
 */
@FunctionalInterface
public interface ObjectiveEvaluator {

    double evaluate(double[] point);
}
