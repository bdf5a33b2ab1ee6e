package com.chicu.simorch.cache;

import com.chicu.simorch.common.error.CacheUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * Для EvaluationService это единственный кэш.
 * Есть primary (Redis) -> работаем через него; primary упал -> молча идём в локальный.
 */
@Slf4j
public class FailoverResultCache implements ResultCache, AutoCloseable {

    private final ResultCache primary; // may be null
    private final ResultCache local;

    public FailoverResultCache(ResultCache primary, ResultCache local) {
        if (local == null) throw new IllegalArgumentException("local cache is required");
        this.primary = primary;
        this.local = local;
    }

    @Override
    public Optional<String> get(String key) {
        if (primary != null) {
            try {
                return primary.get(key);
            } catch (CacheUnavailableException e) {
                log.warn("⚠️ CACHE FALLBACK get -> local: {}", e.getMessage());
            }
        }
        return local.get(key);
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        if (primary != null) {
            try {
                primary.put(key, value, ttl);
                return;
            } catch (CacheUnavailableException e) {
                log.warn("⚠️ CACHE FALLBACK put -> local: {}", e.getMessage());
            }
        }
        local.put(key, value, ttl);
    }

    @Override
    public String backendName() {
        return primary != null ? primary.backendName() : local.backendName();
    }

    @Override
    public void close() throws Exception {
        if (primary instanceof AutoCloseable c) {
            c.close();
        }
    }
}
