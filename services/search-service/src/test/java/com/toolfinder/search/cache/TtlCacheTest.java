package com.toolfinder.search.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.toolfinder.search.support.MutableClock;
import org.junit.jupiter.api.Test;

class TtlCacheTest {

    @Test
    void entriesExpireAfterTtl() {
        MutableClock clock = MutableClock.startingAt(0L);
        TtlCache<String> cache = new TtlCache<>(10, clock);
        cache.put("k", "v", 1_000L);

        clock.advanceMillis(1_000L);
        assertEquals("v", cache.get("k").orElseThrow().getValue());

        clock.advanceMillis(1L);
        assertFalse(cache.get("k").isPresent());
        assertEquals(0, cache.size());
    }

    @Test
    void oldestInsertLeavesFirstAtCapacity() {
        TtlCache<String> cache = new TtlCache<>(2, MutableClock.startingAt(0L));
        cache.put("a", "1", 60_000L);
        cache.put("b", "2", 60_000L);
        cache.put("a", "1b", 60_000L);
        cache.put("c", "3", 60_000L);

        assertEquals(2, cache.size());
        assertFalse(cache.get("b").isPresent());
        assertEquals("1b", cache.get("a").orElseThrow().getValue());
        assertTrue(cache.get("c").isPresent());
    }

    @Test
    void purgeExpiredDropsOnlyStaleEntries() {
        MutableClock clock = MutableClock.startingAt(0L);
        TtlCache<String> cache = new TtlCache<>(10, clock);
        cache.put("short", "x", 100L);
        cache.put("long", "y", 10_000L);

        clock.advanceMillis(500L);

        assertEquals(1, cache.purgeExpired());
        assertEquals(1, cache.size());
        assertTrue(cache.get("long").isPresent());
    }
}
