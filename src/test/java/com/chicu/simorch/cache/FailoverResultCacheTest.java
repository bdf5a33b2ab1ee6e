package com.chicu.simorch.cache;

import com.chicu.simorch.common.error.CacheUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FailoverResultCacheTest {

    @Mock private ResultCache primary;

    private final LocalResultCache local = new LocalResultCache(10);

    @Test
    void primaryHealthy_shouldBeUsed() {
        when(primary.get("k")).thenReturn(Optional.of("remote"));
        when(primary.backendName()).thenReturn("redis");

        FailoverResultCache cache = new FailoverResultCache(primary, local);

        assertEquals("remote", cache.get("k").orElseThrow());
        cache.put("k2", "v", Duration.ofSeconds(5));
        verify(primary).put("k2", "v", Duration.ofSeconds(5));
        assertTrue(local.get("k2").isEmpty());
        assertEquals("redis", cache.backendName());
    }

    @Test
    void primaryDown_shouldFallBackToLocal_withoutSurfacingError() {
        when(primary.get(anyString())).thenThrow(new CacheUnavailableException("down", null));
        doThrow(new CacheUnavailableException("down", null)).when(primary).put(anyString(), anyString(), any());

        FailoverResultCache cache = new FailoverResultCache(primary, local);

        cache.put("k", "v", Duration.ofSeconds(5));
        assertEquals("v", cache.get("k").orElseThrow());
    }

    @Test
    void noPrimary_shouldBeLocalOnly() {
        FailoverResultCache cache = new FailoverResultCache(null, local);

        cache.put("k", "v", Duration.ofSeconds(5));
        assertEquals("v", cache.get("k").orElseThrow());
        assertEquals("local", cache.backendName());
    }
}
