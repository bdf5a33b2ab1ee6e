package com.chicu.simorch.common.error;

public class SimulationException extends RuntimeException {

    private final ErrorKind kind;

    public SimulationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SimulationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
