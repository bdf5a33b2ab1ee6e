package com.chicu.simorch.optimize;

import com.chicu.simorch.common.error.SimulationTimeoutException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Синхронная целевая функция поверх асинхронной оценки.
 *
 * Вызывается только из потока оптимизатора (не coordinator и не workers):
 * ставит оценку в конвейер и блокируется на future с дедлайном.
 * Любая ошибка = конечный штраф + неудачная запись в trace.
 */
@Slf4j
public class BlockingObjectiveBridge implements ObjectiveEvaluator {

    private final ParameterSpace space;
    private final Function<Map<String, Double>, CompletableFuture<EvaluationRecord>> evaluation;
    private final OptimizationState state;
    private final Duration deadline;
    private final double failurePenalty;

    public BlockingObjectiveBridge(OptimizationContext ctx) {
        this(ctx.space(), ctx.evaluator(), ctx.state(), ctx.objectiveTimeout(), ctx.failurePenalty());
    }

    public BlockingObjectiveBridge(ParameterSpace space,
                                   Function<Map<String, Double>, CompletableFuture<EvaluationRecord>> evaluation,
                                   OptimizationState state,
                                   Duration deadline,
                                   double failurePenalty) {
        this.space = space;
        this.evaluation = evaluation;
        this.state = state;
        this.deadline = deadline;
        this.failurePenalty = failurePenalty;
    }

    @Override
    public double evaluate(double[] unitPoint) {
        Map<String, Double> params = space.fromUnit(unitPoint);

        EvaluationRecord record;
        CompletableFuture<EvaluationRecord> future = null;
        try {
            future = evaluation.apply(params);
            record = future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            record = EvaluationRecord.failed(params, failurePenalty, new SimulationTimeoutException("objective", deadline));
        } catch (ExecutionException e) {
            record = EvaluationRecord.failed(params, failurePenalty, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            record = EvaluationRecord.failed(params, failurePenalty, e);
        } catch (RuntimeException e) {
            record = EvaluationRecord.failed(params, failurePenalty, e);
        }

        if (record == null) {
            record = EvaluationRecord.failed(params, failurePenalty, new IllegalStateException("evaluation returned null"));
        }
        if (record.failed()) {
            log.debug("⚠️ objective penalty point={} : {}", params, record.error());
        }

        state.record(record);
        return record.objective();
    }
}
