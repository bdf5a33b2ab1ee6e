package com.chicu.simorch.common.error;

/**
 * Внешний кэш недоступен. Наружу из слоя кэша не выходит:
 * FailoverResultCache ловит и уходит на локальный кэш.
 */
public class CacheUnavailableException extends SimulationException {

    public CacheUnavailableException(String message, Throwable cause) {
        super(ErrorKind.CACHE_UNAVAILABLE, message, cause);
    }
}
