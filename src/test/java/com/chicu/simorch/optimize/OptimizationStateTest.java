package com.chicu.simorch.optimize;

import com.chicu.simorch.common.error.SimulationTimeoutException;
import com.chicu.simorch.eval.MetricExtractor;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OptimizationStateTest {

    private final OptimizationState state = new OptimizationState(500, 400);

    private static EvaluationRecord ok(double beta, double objective) {
        return EvaluationRecord.builder().params(Map.of("beta", beta)).objective(objective).build();
    }

    @Test
    void best_shouldStartAtInfinity() {
        assertEquals(Double.POSITIVE_INFINITY, state.best().objective());
        assertNull(state.best().params());
    }

    @Test
    void best_strictLessThan_tiesKeepEarlier() {
        state.record(ok(1, 0.5));
        state.record(ok(2, 0.5));
        state.record(ok(3, 0.7));

        assertEquals(1.0, state.best().params().get("beta"));

        state.record(ok(4, 0.1));
        assertEquals(4.0, state.best().params().get("beta"));
        assertEquals(4, state.evaluations());
    }

    @Test
    void failedRecord_shouldNeverBecomeBest_evenWithLowPenalty() {
        EvaluationRecord failed = EvaluationRecord.failed(Map.of("beta", 9.0), -1e9,
                new SimulationTimeoutException("objective", Duration.ofSeconds(1)));

        state.record(failed);

        assertEquals(Double.POSITIVE_INFINITY, state.best().objective());
        assertEquals(1, state.trace().size());
        assertTrue(state.trace().get(0).failed());
    }

    @Test
    void objectivePolicy_shouldDefaultMissingMetricsToWorstCase() {
        ObjectivePolicy policy = new ObjectivePolicy();

        assertEquals(1.0, policy.objective(Map.of(), 0.1), 1e-12);
        assertEquals(0.01 - 0.1 * 5.0, policy.objective(
                Map.of(MetricExtractor.BER_ESTIMATE, 0.01, MetricExtractor.LOGIC_MARGIN, 5.0), 0.1), 1e-12);
    }
}
