package com.chicu.simorch.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import redis.clients.jedis.JedisPooled;

import java.net.URI;

@Slf4j
@Configuration
public class CacheConfig {

    /**
     * Redis, если задан и отвечает; иначе локальный Caffeine.
     * Падение Redis позже подхватывает сам FailoverResultCache.
     */
    @Bean
    public FailoverResultCache resultCache(CacheProperties props) {
        LocalResultCache local = new LocalResultCache(props.getMaxItems());

        RedisResultCache redis = null;
        String url = props.getRedisUrl();
        if (url != null && !url.isBlank()) {
            try {
                RedisResultCache candidate = new RedisResultCache(new JedisPooled(URI.create(url.trim())), props.getKeyPrefix());
                if (candidate.reachable()) {
                    redis = candidate;
                } else {
                    candidate.close();
                }
            } catch (RuntimeException e) {
                log.warn("⚠️ Redis init failed ({}), using local cache: {}", url, e.getMessage());
            }
        }

        log.info("🗄 Result cache: {} (maxItems={}, ttl={}s)",
                redis != null ? "redis" : "local", props.getMaxItems(), props.getTtlSeconds());

        return new FailoverResultCache(redis, local);
    }
}
