package com.chicu.simorch.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Кэш сериализованных результатов. Реализации потокобезопасны.
 */
public interface ResultCache {

    Optional<String> get(String key);

    void put(String key, String value, Duration ttl);

    String backendName();
}
