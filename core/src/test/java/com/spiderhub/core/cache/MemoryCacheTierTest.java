package com.spiderhub.core.cache;

import com.spiderhub.test.TestBase;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the in-memory cache tier
 */
class MemoryCacheTierTest extends TestBase {

    private final AtomicLong now = new AtomicLong(0L);

    @Test
    void testEntryCountIsBounded() {
        MemoryCacheTier tier = new MemoryCacheTier(10, 10_000_000, now::get);
        for (int i = 0; i < 50; i++) {
            tier.put(new CacheEntry("k" + i, "{}", now.get(), 60_000, CacheTier.MEMORY));
        }

        assertTrue(tier.size() <= 10, "Size should stay within the entry bound, was " + tier.size());
    }

    @Test
    void testBytesAreBounded() {
        MemoryCacheTier tier = new MemoryCacheTier(1_000, 4_096, now::get);
        String big = "x".repeat(1_000);
        for (int i = 0; i < 20; i++) {
            tier.put(new CacheEntry("k" + i, big, now.get(), 60_000, CacheTier.MEMORY));
        }

        assertTrue(tier.weightedBytes() <= 4_096, "Weight should stay within the byte bound");
    }

    @Test
    void testPerEntryTtl() {
        MemoryCacheTier tier = new MemoryCacheTier(100, 1_000_000, now::get);
        tier.put(new CacheEntry("short", "{}", now.get(), 100, CacheTier.MEMORY));
        tier.put(new CacheEntry("long", "{}", now.get(), 10_000, CacheTier.MEMORY));

        now.addAndGet(200);

        assertNull(tier.get("short"));
        assertNotNull(tier.get("long"));
    }
}
