package com.chicu.simorch.device;

import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Builder
public record TruthTableResult(
        String runId,
        Instant timestamp,
        String path,
        List<Map<String, String>> rows
) {

    public TruthTableResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }
}
