package com.chicu.simorch.optimize.strategy;

import com.chicu.simorch.optimize.OptimizationContext;

/**
 * Стратегия выполняет ровно ctx.nCalls() оценок и пишет каждую в ctx.state().
 */
public interface OptimizationStrategy {

    String name();

    void run(OptimizationContext ctx);
}
