package com.customer.identity.cache;

import com.customer.identity.search.QueryType;
import com.customer.identity.search.SearchMode;
import com.customer.identity.search.SearchResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Search Result Cache Tests")
class CaffeineSearchResultCacheTest {

    private static SearchResult result(String query) {
        return new SearchResult(query, QueryType.NAME, SearchMode.RANKED, List.of());
    }

    @Nested
    @DisplayName("CaffeineSearchResultCache")
    class CaffeineTests {

        private final CaffeineSearchResultCache cache = new CaffeineSearchResultCache(CacheConfig.defaults());

        @Test
        @DisplayName("Should return cached results by query and limit")
        void putAndGet() {
            SearchResult cached = result("jane doe");
            cache.put("jane doe", 20, cached);

            assertSame(cached, cache.get("jane doe", 20).orElseThrow());
            assertTrue(cache.get("jane doe", 10).isEmpty());
            assertTrue(cache.get("john doe", 20).isEmpty());
        }

        @Test
        @DisplayName("Should track hits and misses")
        void stats() {
            cache.put("jane doe", 20, result("jane doe"));
            cache.get("jane doe", 20);
            cache.get("jane doe", 20);
            cache.get("bob", 20);

            CacheStats stats = cache.getStats();
            assertEquals(2, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(2.0 / 3.0, stats.hitRate(), 1e-9);
        }

        @Test
        @DisplayName("A merge clears every cached result")
        void mergeInvalidates() {
            cache.put("jane doe", 20, result("jane doe"));
            cache.put("acme", 20, result("acme"));

            cache.onMerge(1L, List.of(2L, 3L));

            assertTrue(cache.get("jane doe", 20).isEmpty());
            assertTrue(cache.get("acme", 20).isEmpty());
        }
    }

    @Nested
    @DisplayName("NoOpSearchResultCache")
    class NoOpTests {

        @Test
        @DisplayName("Should never return anything")
        void neverCaches() {
            NoOpSearchResultCache cache = new NoOpSearchResultCache();
            cache.put("jane doe", 20, result("jane doe"));

            assertTrue(cache.get("jane doe", 20).isEmpty());
            assertEquals(CacheStats.empty(), cache.getStats());
            assertDoesNotThrow(cache::invalidateAll);
        }
    }

    @Nested
    @DisplayName("CacheConfig")
    class ConfigTests {

        @Test
        @DisplayName("Should reject non-positive sizes and TTLs")
        void validation() {
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 30, true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(100, 0, true));
        }

        @Test
        @DisplayName("Defaults are enabled and disabled() is not")
        void factories() {
            assertTrue(CacheConfig.defaults().enabled());
            assertFalse(CacheConfig.disabled().enabled());
            assertEquals(0.0, CacheStats.empty().hitRate());
        }
    }
}
