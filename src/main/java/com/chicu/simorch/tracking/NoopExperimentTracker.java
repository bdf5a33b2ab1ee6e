package com.chicu.simorch.tracking;

import java.util.Map;

public class NoopExperimentTracker implements ExperimentTracker {

    @Override
    public void logRun(Map<String, ?> params, Map<String, Double> metrics) {
        // tracking disabled
    }

    @Override
    public String backendName() {
        return "disabled";
    }
}
