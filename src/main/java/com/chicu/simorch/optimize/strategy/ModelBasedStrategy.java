package com.chicu.simorch.optimize.strategy;

import com.chicu.simorch.common.error.ErrorKind;
import com.chicu.simorch.common.error.SimulationException;
import com.chicu.simorch.config.SimulationExecutors;
import com.chicu.simorch.optimize.BlockingObjectiveBridge;
import com.chicu.simorch.optimize.OptimizationContext;
import com.chicu.simorch.optimize.props.OptimizerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Модельный поиск: BOBYQA (квадратичная модель в trust region) в единичном кубе.
 *
 * Цикл оптимизатора блокирующий, поэтому живёт в executors.optimizer(),
 * каждая оценка идёт через BlockingObjectiveBridge. Если BOBYQA сошёлся раньше
 * бюджета, остаток добирает случайный поиск.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelBasedStrategy implements OptimizationStrategy {

    public static final String NAME = "model-based (BOBYQA)";

    /** BOBYQA не работает в 1D */
    public static final int MIN_DIMENSION = 2;

    private final OptimizerProperties props;
    private final SimulationExecutors executors;
    private final RandomSearchStrategy randomSearch;

    @Override
    public String name() {
        return NAME;
    }

    public boolean supports(int dimension) {
        return dimension >= MIN_DIMENSION;
    }

    @Override
    public void run(OptimizationContext ctx) {
        int d = ctx.space().size();
        if (!supports(d)) {
            log.info("🎲 d={} < {} -> random search", d, MIN_DIMENSION);
            randomSearch.run(ctx);
            return;
        }

        long before = ctx.state().evaluations();
        BlockingObjectiveBridge bridge = new BlockingObjectiveBridge(ctx);
        int npt = interpolationPoints(d, ctx.randomStarts());

        Future<?> loop = executors.optimizer().submit(() -> minimize(bridge, d, npt, ctx.nCalls()));
        try {
            loop.get();
        } catch (ExecutionException e) {
            // точки, посчитанные до сбоя, уже в trace; остаток доберёт random search
            log.warn("⚠️ BOBYQA aborted after {} evals : {}",
                    ctx.state().evaluations() - before, e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
        } catch (InterruptedException e) {
            loop.cancel(true);
            Thread.currentThread().interrupt();
            throw new SimulationException(ErrorKind.INTERNAL, "optimization interrupted", e);
        }

        int used = (int) (ctx.state().evaluations() - before);
        int remaining = ctx.nCalls() - used;
        if (remaining > 0) {
            log.info("🎲 BOBYQA converged after {} evals, random search for remaining {}", used, remaining);
            randomSearch.runBudget(ctx, remaining);
        }
    }

    private void minimize(BlockingObjectiveBridge bridge, int d, int npt, int maxEval) {
        BOBYQAOptimizer optimizer = new BOBYQAOptimizer(
                npt,
                props.getInitialTrustRegionRadius(),
                props.getStoppingTrustRegionRadius()
        );

        double[] start = new double[d];
        double[] lower = new double[d];
        double[] upper = new double[d];
        Arrays.fill(start, 0.5);
        Arrays.fill(upper, 1.0);

        try {
            optimizer.optimize(
                    new MaxEval(maxEval),
                    new ObjectiveFunction(bridge::evaluate),
                    GoalType.MINIMIZE,
                    new InitialGuess(start),
                    new SimpleBounds(lower, upper)
            );
        } catch (TooManyEvaluationsException e) {
            // бюджет исчерпан: нормальное завершение
            log.debug("BOBYQA budget exhausted: {}", maxEval);
        } catch (MathIllegalStateException e) {
            log.warn("⚠️ BOBYQA stopped: {}", e.getMessage());
        }
    }

    /**
     * BOBYQA требует число точек интерполяции в [d+2, (d+1)(d+2)/2].
     */
    static int interpolationPoints(int d, int randomStarts) {
        int min = d + 2;
        int max = (d + 1) * (d + 2) / 2;
        return Math.max(min, Math.min(max, randomStarts));
    }
}
