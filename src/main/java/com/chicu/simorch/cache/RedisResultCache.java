package com.chicu.simorch.cache;

import com.chicu.simorch.common.error.CacheUnavailableException;
import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-бэкенд: SETEX prefix+key. Любая ошибка Jedis -> CacheUnavailableException.
 */
@Slf4j
public class RedisResultCache implements ResultCache, AutoCloseable {

    private final JedisPooled jedis;
    private final String prefix;

    public RedisResultCache(JedisPooled jedis, String prefix) {
        this.jedis = jedis;
        this.prefix = prefix == null ? "" : prefix;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(jedis.get(prefix + key));
        } catch (JedisException e) {
            throw new CacheUnavailableException("redis get failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        try {
            jedis.setex(prefix + key, Math.max(1L, ttl.toSeconds()), value);
        } catch (JedisException e) {
            throw new CacheUnavailableException("redis setex failed: " + e.getMessage(), e);
        }
    }

    /**
     * Проверка доступности при старте: любой round-trip до сервера.
     */
    public boolean reachable() {
        try {
            jedis.get(prefix + "__probe__");
            return true;
        } catch (JedisException e) {
            log.warn("⚠️ Redis NOT available: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String backendName() {
        return "redis";
    }

    @Override
    public void close() {
        jedis.close();
    }
}
