package com.chicu.simorch.optimize;

import java.util.ArrayList;
import java.util.List;

/**
 * Ограниченный trace: как только записей больше cap, оставляем последние trimTo.
 */
public class TraceBuffer {

    private final int cap;
    private final int trimTo;
    private final List<EvaluationRecord> records = new ArrayList<>();
    private long total;

    public TraceBuffer(int cap, int trimTo) {
        if (cap <= 0 || trimTo <= 0 || trimTo >= cap) {
            throw new IllegalArgumentException("trace: требуется 0 < trimTo < cap, получено cap=" + cap + " trimTo=" + trimTo);
        }
        this.cap = cap;
        this.trimTo = trimTo;
    }

    public void append(EvaluationRecord record) {
        records.add(record);
        total++;
        if (records.size() > cap) {
            records.subList(0, records.size() - trimTo).clear();
        }
    }

    public int size() {
        return records.size();
    }

    /**
     * Сколько записей было добавлено всего (может быть больше size()).
     */
    public long total() {
        return total;
    }

    public List<EvaluationRecord> snapshot() {
        return List.copyOf(records);
    }

    public List<EvaluationRecord> last(int n) {
        int from = Math.max(0, records.size() - Math.max(0, n));
        return List.copyOf(records.subList(from, records.size()));
    }
}
