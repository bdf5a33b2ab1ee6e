package com.chicu.simorch.simulator;

import com.chicu.simorch.common.error.SimulationFailedException;

import java.time.Duration;

public record ProcessOutcome(
        int exitCode,
        String stdout,
        String stderr,
        Duration took
) {

    public ProcessOutcome {
        if (stdout == null) stdout = "";
        if (stderr == null) stderr = "";
        if (took == null) took = Duration.ZERO;
    }

    public static ProcessOutcome of(int exitCode, String stdout, String stderr) {
        return new ProcessOutcome(exitCode, stdout, stderr, Duration.ZERO);
    }

    public boolean ok() {
        return exitCode == 0;
    }

    /**
     * Ненулевой exit code -> SimulationFailedException со stderr.
     */
    public ProcessOutcome requireSuccess(String operation) {
        if (!ok()) {
            throw new SimulationFailedException(operation, exitCode, stderr);
        }
        return this;
    }
}
