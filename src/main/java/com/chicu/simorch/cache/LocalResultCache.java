package com.chicu.simorch.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;

/**
 * In-process кэш: ограничен по количеству, TTL задаётся на каждую запись
 * и отсчитывается от записи (чтение срок не продлевает).
 * Вытеснение при переполнении у Caffeine W-TinyLFU (частота + давность), а не строгий LRU:
 * гарантируется только граница размера и то, что свежая запись переживает вытеснение.
 */
public class LocalResultCache implements ResultCache {

    private final Cache<String, Entry> cache;

    public LocalResultCache(int maxItems) {
        this(maxItems, Ticker.systemTicker());
    }

    public LocalResultCache(int maxItems, Ticker ticker) {
        if (maxItems <= 0) {
            throw new IllegalArgumentException("maxItems must be > 0");
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxItems)
                .expireAfter(new EntryExpiry())
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    @Override
    public Optional<String> get(String key) {
        Entry e = cache.getIfPresent(key);
        return e == null ? Optional.empty() : Optional.of(e.value());
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        cache.put(key, new Entry(value, ttl.toNanos()));
    }

    @Override
    public String backendName() {
        return "local";
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private record Entry(String value, long ttlNanos) {}

    private static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
