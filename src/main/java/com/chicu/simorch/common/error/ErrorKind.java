package com.chicu.simorch.common.error;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Классы ошибок оркестратора.
 * Вызывающая сторона решает по kind: ретраить (TIMEOUT) или нет.
 */
public enum ErrorKind {

    INVALID_ARGUMENT,
    SIMULATION_FAILED,
    TIMEOUT,
    CACHE_UNAVAILABLE,
    INTERNAL;

    public static ErrorKind of(Throwable t) {
        Throwable e = unwrap(t);
        if (e instanceof SimulationException se) return se.kind();
        if (e instanceof TimeoutException) return TIMEOUT;
        if (e instanceof IllegalArgumentException) return INVALID_ARGUMENT;
        return INTERNAL;
    }

    /**
     * Снимаем обёртки CompletableFuture/Future, чтобы добраться до реальной причины.
     */
    public static Throwable unwrap(Throwable t) {
        Throwable e = t;
        while ((e instanceof CompletionException || e instanceof ExecutionException) && e.getCause() != null) {
            e = e.getCause();
        }
        return e;
    }
}
