package com.chicu.simorch.common.error;

/**
 * Симулятор завершился с ненулевым exit code. Автоматически не ретраим.
 */
public class SimulationFailedException extends SimulationException {

    private final int exitCode;
    private final String stderr;

    public SimulationFailedException(String operation, int exitCode, String stderr) {
        super(ErrorKind.SIMULATION_FAILED, messageOf(operation, exitCode, stderr));
        this.exitCode = exitCode;
        this.stderr = stderr == null ? "" : stderr;
    }

    public int exitCode() {
        return exitCode;
    }

    public String stderr() {
        return stderr;
    }

    private static String messageOf(String operation, int exitCode, String stderr) {
        String s = stderr == null ? "" : stderr.strip();
        if (s.isEmpty()) {
            return "plogic " + operation + " failed (exit=" + exitCode + ")";
        }
        return s;
    }
}
