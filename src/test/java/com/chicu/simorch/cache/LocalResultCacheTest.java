package com.chicu.simorch.cache;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class LocalResultCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private final LocalResultCache cache = new LocalResultCache(100, nanos::get);

    @Test
    void get_shouldReturnValue_untilTtlElapses() {
        cache.put("k", "v", Duration.ofSeconds(10));
        assertEquals("v", cache.get("k").orElseThrow());

        nanos.addAndGet(Duration.ofSeconds(9).toNanos());
        assertEquals("v", cache.get("k").orElseThrow());

        nanos.addAndGet(Duration.ofSeconds(2).toNanos());
        assertTrue(cache.get("k").isEmpty(), "после TTL запись = промах");
    }

    @Test
    void read_shouldNotExtendExpiry() {
        cache.put("k", "v", Duration.ofSeconds(10));
        for (int i = 0; i < 9; i++) {
            nanos.addAndGet(Duration.ofSeconds(1).toNanos());
            assertTrue(cache.get("k").isPresent());
        }
        nanos.addAndGet(Duration.ofSeconds(2).toNanos());
        assertTrue(cache.get("k").isEmpty());
    }

    @Test
    void size_shouldStayWithinBound() {
        LocalResultCache small = new LocalResultCache(5, nanos::get);
        for (int i = 0; i < 50; i++) {
            small.put("k" + i, "v" + i, Duration.ofMinutes(1));
        }
        assertTrue(small.size() <= 5, "size=" + small.size());
    }

    @Test
    void overflow_shouldKeepFreshestEntry() {
        // W-TinyLFU: кого вытеснить решает частота, но только что записанное остаётся
        LocalResultCache small = new LocalResultCache(4, nanos::get);
        for (int i = 0; i < 20; i++) {
            small.put("k" + i, "v" + i, Duration.ofMinutes(1));
            assertEquals(Optional.of("v" + i), small.get("k" + i));
        }
        assertTrue(small.size() <= 4, "size=" + small.size());
    }

    @Test
    void constructor_shouldRejectNonPositiveBound() {
        assertThrows(IllegalArgumentException.class, () -> new LocalResultCache(0));
    }
}
