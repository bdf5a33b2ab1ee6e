package com.chicu.simorch.optimize;

import java.util.List;

/**
 * Состояние одного прогона: trace + best. Один прогон = один экземпляр,
 * record() вызывается только из последовательности вызовов этого прогона.
 */
public class OptimizationState {

    private final TraceBuffer trace;
    private BestPoint best = BestPoint.none();

    public OptimizationState(int traceCap, int traceTrimTo) {
        this.trace = new TraceBuffer(traceCap, traceTrimTo);
    }

    /**
     * best обновляется только строгим "<" (при равенстве остаётся ранняя точка);
     * неудачные точки в best не попадают.
     */
    public synchronized void record(EvaluationRecord record) {
        trace.append(record);
        if (!record.failed() && record.objective() < best.objective()) {
            best = new BestPoint(record.objective(), record.params(), record.result());
        }
    }

    public synchronized BestPoint best() {
        return best;
    }

    public synchronized long evaluations() {
        return trace.total();
    }

    public synchronized List<EvaluationRecord> trace() {
        return trace.snapshot();
    }

    public synchronized List<EvaluationRecord> lastRecords(int n) {
        return trace.last(n);
    }
}
