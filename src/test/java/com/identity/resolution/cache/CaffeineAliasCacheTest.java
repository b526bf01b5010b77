package com.identity.resolution.cache;

import com.identity.resolution.core.model.AliasScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CaffeineAliasCacheTest {

    private AliasCache cache;

    @BeforeEach
    void setUp() {
        cache = CacheConfig.defaults().create();
        cache.put(AliasScope.NAME, "wa health", "client-wa-health");
        cache.put(AliasScope.NAME, "wa dept of health", "client-wa-health");
        cache.put(AliasScope.REFERENCE_NUMBER, "Q-2040", "opp-gha-imaging");
    }

    @Test
    @DisplayName("Lookups are keyed by scope")
    void testScopedLookup() {
        assertEquals(Optional.of("client-wa-health"), cache.get(AliasScope.NAME, "wa health"));
        assertTrue(cache.get(AliasScope.REFERENCE_NUMBER, "wa health").isEmpty());
    }

    @Test
    @DisplayName("Invalidating an entity drops every key resolving to it")
    void testInvalidateEntity() {
        cache.invalidate("client-wa-health");

        assertTrue(cache.get(AliasScope.NAME, "wa health").isEmpty());
        assertTrue(cache.get(AliasScope.NAME, "wa dept of health").isEmpty());
        assertEquals(Optional.of("opp-gha-imaging"), cache.get(AliasScope.REFERENCE_NUMBER, "Q-2040"));
    }

    @Test
    @DisplayName("A merge invalidates both sides")
    void testOnMerge() {
        cache.onMerge("opp-gha-imaging", "client-wa-health");

        assertTrue(cache.get(AliasScope.NAME, "wa health").isEmpty());
        assertTrue(cache.get(AliasScope.REFERENCE_NUMBER, "Q-2040").isEmpty());
    }

    @Test
    @DisplayName("Single keys can be dropped")
    void testInvalidateKey() {
        cache.invalidateKey(AliasScope.NAME, "wa health");

        assertTrue(cache.get(AliasScope.NAME, "wa health").isEmpty());
        assertTrue(cache.get(AliasScope.NAME, "wa dept of health").isPresent());
    }

    @Test
    @DisplayName("Hits and misses are counted")
    void testStats() {
        cache.get(AliasScope.NAME, "wa health");
        cache.get(AliasScope.NAME, "unknown");

        CacheStats stats = cache.getStats();
        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(0.5, stats.hitRate());
    }

    @Test
    @DisplayName("Disabled caching never returns a value")
    void testDisabled() {
        AliasCache noop = CacheConfig.disabled().create();
        noop.put(AliasScope.NAME, "wa health", "client-wa-health");

        assertTrue(noop.get(AliasScope.NAME, "wa health").isEmpty());
        assertEquals(CacheStats.empty(), noop.getStats());
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 10, true));
    }
}
