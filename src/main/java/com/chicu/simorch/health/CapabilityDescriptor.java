package com.chicu.simorch.health;

import lombok.Builder;

import java.util.List;

@Builder
public record CapabilityDescriptor(
        List<String> availableOperations,
        String optimizerStrategy,
        String cacheBackend,
        int workerPoolSize,
        String metricsBackend,
        String trackingBackend
) {
}
