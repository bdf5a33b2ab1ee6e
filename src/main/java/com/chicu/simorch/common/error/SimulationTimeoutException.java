package com.chicu.simorch.common.error;

import java.time.Duration;

public class SimulationTimeoutException extends SimulationException {

    private final String stage;
    private final Duration timeout;

    public SimulationTimeoutException(String stage, Duration timeout) {
        super(ErrorKind.TIMEOUT, "plogic " + stage + " timed out after " + timeout.toMillis() + "ms");
        this.stage = stage;
        this.timeout = timeout;
    }

    public String stage() {
        return stage;
    }

    public Duration timeout() {
        return timeout;
    }
}
