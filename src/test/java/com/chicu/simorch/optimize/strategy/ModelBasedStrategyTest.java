package com.chicu.simorch.optimize.strategy;

import com.chicu.simorch.config.SimulationExecutors;
import com.chicu.simorch.optimize.EvaluationRecord;
import com.chicu.simorch.optimize.OptimizationContext;
import com.chicu.simorch.optimize.OptimizationState;
import com.chicu.simorch.optimize.ParameterDimension;
import com.chicu.simorch.optimize.ParameterSpace;
import com.chicu.simorch.optimize.props.OptimizerProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class ModelBasedStrategyTest {

    private final SimulationExecutors executors = new SimulationExecutors(2);
    private final OptimizerProperties props = new OptimizerProperties();
    private final ModelBasedStrategy strategy =
            new ModelBasedStrategy(props, executors, new RandomSearchStrategy(props, executors));

    @AfterEach
    void tearDown() {
        executors.shutdown();
    }

    @Test
    void interpolationPoints_shouldBeClampedToBobyqaRange() {
        assertEquals(4, ModelBasedStrategy.interpolationPoints(2, 1));
        assertEquals(6, ModelBasedStrategy.interpolationPoints(2, 100));
        assertEquals(8, ModelBasedStrategy.interpolationPoints(5, 8));
        assertEquals(7, ModelBasedStrategy.interpolationPoints(5, 2));
    }

    @Test
    void run_quadraticBowl_shouldApproachMinimum_withinBudget() {
        ParameterSpace space = new ParameterSpace(List.of(
                new ParameterDimension("beta", 0, 10),
                new ParameterDimension("g_geom", 0, 1)));
        OptimizationState state = new OptimizationState(500, 400);

        OptimizationContext ctx = new OptimizationContext(space, 40, 5, new Random(1), state,
                Duration.ofSeconds(5), 1e6,
                p -> CompletableFuture.supplyAsync(() -> {
                    double obj = Math.pow(p.get("beta") - 3, 2) + Math.pow(p.get("g_geom") - 0.25, 2);
                    return EvaluationRecord.builder().params(p).objective(obj).build();
                }));

        strategy.run(ctx);

        assertEquals(40, state.evaluations());
        assertTrue(state.best().objective() < 0.05, "best=" + state.best().objective());
    }

    @Test
    void supports_shouldRequireTwoDimensions() {
        assertFalse(strategy.supports(1));
        assertTrue(strategy.supports(2));
    }
}
