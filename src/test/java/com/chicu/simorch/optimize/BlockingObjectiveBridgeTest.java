package com.chicu.simorch.optimize;

import com.chicu.simorch.common.error.ErrorKind;
import com.chicu.simorch.common.error.SimulationFailedException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class BlockingObjectiveBridgeTest {

    private static final double PENALTY = 1e6;

    private final ParameterSpace space = new ParameterSpace(List.of(
            new ParameterDimension("beta", 10, 20),
            new ParameterDimension("g_geom", 0.5, 1.0)));
    private final OptimizationState state = new OptimizationState(500, 400);

    private BlockingObjectiveBridge bridge(Function<Map<String, Double>, CompletableFuture<EvaluationRecord>> f,
                                           Duration deadline) {
        return new BlockingObjectiveBridge(space, f, state, deadline, PENALTY);
    }

    @Test
    void success_shouldReturnObjective_andRecordPoint() {
        BlockingObjectiveBridge b = bridge(p -> CompletableFuture.supplyAsync(
                () -> EvaluationRecord.builder().params(p).objective(p.get("beta") / 100).build()), Duration.ofSeconds(5));

        double v = b.evaluate(new double[]{1.0, 0.0});

        assertEquals(0.2, v, 1e-12);
        assertEquals(Map.of("beta", 20.0, "g_geom", 0.5), state.best().params());
    }

    @Test
    void timeout_shouldReturnPenalty_andRecordTimeoutFailure() {
        BlockingObjectiveBridge b = bridge(p -> new CompletableFuture<>(), Duration.ofMillis(100));

        double v = b.evaluate(new double[]{0.5, 0.5});

        assertEquals(PENALTY, v);
        EvaluationRecord r = state.trace().get(0);
        assertTrue(r.failed());
        assertEquals(ErrorKind.TIMEOUT, r.errorKind());
        assertEquals(Double.POSITIVE_INFINITY, state.best().objective());
    }

    @Test
    void failedFuture_shouldReturnPenalty_withoutThrowing() {
        BlockingObjectiveBridge b = bridge(
                p -> CompletableFuture.failedFuture(new SimulationFailedException("cascade", 1, "boom")),
                Duration.ofSeconds(1));

        double v = assertDoesNotThrow(() -> b.evaluate(new double[]{0.1, 0.1}));

        assertEquals(PENALTY, v);
        assertEquals(ErrorKind.SIMULATION_FAILED, state.trace().get(0).errorKind());
        assertEquals("boom", state.trace().get(0).error());
    }

    @Test
    void throwingEvaluator_shouldBeContained() {
        BlockingObjectiveBridge b = bridge(p -> {
            throw new IllegalArgumentException("bad point");
        }, Duration.ofSeconds(1));

        assertEquals(PENALTY, b.evaluate(new double[]{0.1, 0.1}));
        assertEquals(ErrorKind.INVALID_ARGUMENT, state.trace().get(0).errorKind());
    }
}
