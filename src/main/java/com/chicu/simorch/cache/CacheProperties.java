package com.chicu.simorch.cache;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "simorch.cache")
public class CacheProperties {

    /**
     * Пример: redis://127.0.0.1:6379/0
     * Пусто = только локальный кэш.
     */
    private String redisUrl = "";

    /**
     * Потолок локального кэша (штук).
     */
    private int maxItems = 1024;

    /**
     * TTL результата cascade.
     */
    private long ttlSeconds = 1800;

    private String keyPrefix = "plogic:";

    public Duration ttl() {
        return Duration.ofSeconds(Math.max(1, ttlSeconds));
    }
}
