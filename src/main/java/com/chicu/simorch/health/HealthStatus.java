package com.chicu.simorch.health;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record HealthStatus(String status, String detail) {

    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";

    public static HealthStatus healthy(String detail) {
        return new HealthStatus(HEALTHY, detail);
    }

    public static HealthStatus unhealthy(String detail) {
        return new HealthStatus(UNHEALTHY, detail);
    }

    @JsonIgnore
    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
