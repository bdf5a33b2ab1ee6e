package com.chicu.simorch.optimize.strategy;

import com.chicu.simorch.config.SimulationExecutors;
import com.chicu.simorch.optimize.EvaluationRecord;
import com.chicu.simorch.optimize.OptimizationContext;
import com.chicu.simorch.optimize.ParameterDimension;
import com.chicu.simorch.optimize.ParameterSpace;
import com.chicu.simorch.optimize.props.OptimizerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Случайный поиск пачками по min(maxBatch, poolSize) параллельных оценок.
 * Результаты пачки пишутся в состояние последовательно, после того как вся пачка завершилась.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RandomSearchStrategy implements OptimizationStrategy {

    public static final String NAME = "random-search";

    private final OptimizerProperties props;
    private final SimulationExecutors executors;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void run(OptimizationContext ctx) {
        runBudget(ctx, ctx.nCalls());
    }

    public void runBudget(OptimizationContext ctx, int budget) {
        int batch = batchSize();
        int remaining = budget;
        int round = 0;

        while (remaining > 0) {
            int k = Math.min(batch, remaining);

            List<CompletableFuture<EvaluationRecord>> futures = new ArrayList<>(k);
            for (int i = 0; i < k; i++) {
                futures.add(evaluate(ctx, sample(ctx.space(), ctx.random())));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            for (CompletableFuture<EvaluationRecord> f : futures) {
                ctx.state().record(f.join());
            }

            remaining -= k;
            round++;
            log.debug("🎲 RANDOM batch={} size={} remaining={} best={}",
                    round, k, remaining, ctx.state().best().objective());
        }
    }

    int batchSize() {
        return Math.max(1, Math.min(props.getMaxBatch(), executors.poolSize()));
    }

    static Map<String, Double> sample(ParameterSpace space, Random rnd) {
        Map<String, Double> point = new LinkedHashMap<>();
        for (ParameterDimension d : space.dimensions()) {
            point.put(d.name(), d.fromUnit(rnd.nextDouble()));
        }
        return point;
    }

    private static CompletableFuture<EvaluationRecord> evaluate(OptimizationContext ctx, Map<String, Double> point) {
        CompletableFuture<EvaluationRecord> f;
        try {
            f = ctx.evaluator().apply(point);
        } catch (RuntimeException e) {
            f = CompletableFuture.failedFuture(e);
        }
        return f.orTimeout(ctx.objectiveTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((r, e) -> {
                    if (e != null) return EvaluationRecord.failed(point, ctx.failurePenalty(), e);
                    if (r == null) {
                        return EvaluationRecord.failed(point, ctx.failurePenalty(),
                                new IllegalStateException("evaluation returned null"));
                    }
                    return r;
                });
    }
}
