package com.spiderhub.core.cache;

import com.spiderhub.common.error.ErrorKind;
import com.spiderhub.common.model.ContentEnvelope;
import com.spiderhub.common.model.ContentItem;
import com.spiderhub.common.model.EnvelopeStatus;
import com.spiderhub.test.TestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the two-tier result cache and request collapsing
 */
class ResultCacheTest extends TestBase {

    private final AtomicLong now = new AtomicLong(1_000_000L);
    private MemoryCacheTier memory;
    private DiskCacheTier disk;
    private ResultCache cache;

    @BeforeEach
    void createCache() {
        memory = new MemoryCacheTier(100, 1024 * 1024, now::get);
        disk = new DiskCacheTier(newDatabase(), now::get, 100);
        cache = new ResultCache(memory, disk, now::get, true);
    }

    private static ContentEnvelope envelope(String name) {
        return ContentEnvelope.builder().item(new ContentItem(name, name, "", "")).page(1).build();
    }

    private static CacheKey key(String signature) {
        return new CacheKey("site", "search", signature);
    }

    @Test
    void testPutThenGetHitsMemory() {
        cache.put(key("a"), envelope("one"), 60_000);

        CacheLookup lookup = cache.get(key("a"));
        assertTrue(lookup.isHit());
        var hit = (CacheLookup.Hit) lookup;
        assertEquals(CacheTier.MEMORY, hit.tier());
        assertEquals("one", hit.value().getItems().get(0).getName());
    }

    @Test
    void testErrorEnvelopesAreNeverStored() {
        cache.put(key("err"), ContentEnvelope.failed(ErrorKind.PERMANENT_UPSTREAM, "gone"), 60_000);
        cache.put(key("timeout"), ContentEnvelope.timedOut("slow"), 60_000);

        assertFalse(cache.get(key("err")).isHit());
        assertFalse(cache.get(key("timeout")).isHit());
        assertEquals(0, disk.count(), "Nothing should reach the disk tier");
    }

    @Test
    void testZeroTtlDisablesCaching() {
        cache.put(key("a"), envelope("one"), 0);

        assertFalse(cache.get(key("a")).isHit());
    }

    @Test
    void testEntriesExpireAfterTtl() {
        cache.put(key("a"), envelope("one"), 1_000);

        now.addAndGet(999);
        assertTrue(cache.get(key("a")).isHit(), "Still fresh before the TTL ran out");

        now.addAndGet(2);
        assertFalse(cache.get(key("a")).isHit(), "Expired in both tiers");
    }

    @Test
    void testDiskHitIsPromotedToMemory() {
        cache.put(key("a"), envelope("one"), 60_000);
        memory.clear();

        var first = (CacheLookup.Hit) cache.get(key("a"));
        assertEquals(CacheTier.DISK, first.tier());

        var second = (CacheLookup.Hit) cache.get(key("a"));
        assertEquals(CacheTier.MEMORY, second.tier(), "Second lookup should come from memory");
        assertEquals(1, cache.stats().diskHits());
    }

    @Test
    void testInvalidateBySitePrefix() {
        cache.put(new CacheKey("site", "home", "f"), envelope("home"), 60_000);
        cache.put(new CacheKey("site", "search", "x|-"), envelope("hit"), 60_000);
        cache.put(new CacheKey("other", "home", "f"), envelope("keep"), 60_000);

        cache.invalidate(CacheKey.sitePrefix("site"));

        assertFalse(cache.get(new CacheKey("site", "home", "f")).isHit());
        assertFalse(cache.get(new CacheKey("site", "search", "x|-")).isHit());
        assertTrue(cache.get(new CacheKey("other", "home", "f")).isHit());
    }

    @Test
    void testCorruptDiskRowDegradesToMiss() {
        disk.put(new CacheEntry("site|search|bad", "{not json", now.get(), 60_000, CacheTier.DISK));

        assertFalse(cache.get(key("bad")).isHit());
        assertTrue(cache.stats().errors() > 0);
    }

    @Test
    void testGetOrLoadCachesResult() throws Exception {
        AtomicInteger loads = new AtomicInteger();

        cache.getOrLoad(key("a"), 60_000, () -> {
            loads.incrementAndGet();
            return envelope("one");
        });
        ContentEnvelope again = cache.getOrLoad(key("a"), 60_000, () -> {
            loads.incrementAndGet();
            return envelope("two");
        });

        assertEquals(1, loads.get());
        assertEquals("one", again.getItems().get(0).getName());
    }

    @Test
    void testConcurrentMissesShareOneLoad() throws Exception {
        int callers = 8;
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(callers);

        try {
            List<Future<ContentEnvelope>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> cache.getOrLoad(key("shared"), 60_000, () -> {
                    loads.incrementAndGet();
                    started.countDown();
                    release.await();
                    return envelope("shared");
                })));
            }
            assertTrue(started.await(5, TimeUnit.SECONDS));
            // give the other callers time to queue up behind the leader
            Thread.sleep(100);
            release.countDown();

            for (Future<ContentEnvelope> f : futures) {
                assertEquals("shared", f.get(5, TimeUnit.SECONDS).getItems().get(0).getName());
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, loads.get(), "Only one upstream load for concurrent misses");
        assertTrue(cache.stats().sharedLoads() > 0);
    }

    @Test
    void testFailedLoadIsSharedButNotCached() throws Exception {
        ContentEnvelope failed = cache.getOrLoad(key("f"), 60_000,
                () -> ContentEnvelope.failed(ErrorKind.TRANSIENT_NETWORK, "down"));

        assertEquals(EnvelopeStatus.FAILED, failed.getStatus());
        assertFalse(cache.get(key("f")).isHit());
    }

    @Test
    void testInterruptedLoadIsNotCached() throws Exception {
        Thread leader = new Thread(() -> {
            try {
                cache.getOrLoad(key("i"), 60_000, () -> {
                    Thread.sleep(10_000);
                    return envelope("late");
                });
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        leader.start();
        Thread.sleep(100);
        leader.interrupt();
        leader.join(5_000);

        assertFalse(cache.get(key("i")).isHit());
        ContentEnvelope fresh = cache.getOrLoad(key("i"), 60_000, () -> envelope("fresh"));
        assertEquals("fresh", fresh.getItems().get(0).getName(), "Next caller should load anew");
    }

    @Test
    void testDisabledCacheAlwaysLoads() throws Exception {
        ResultCache off = new ResultCache(memory, null, now::get, false);
        AtomicInteger loads = new AtomicInteger();

        off.getOrLoad(key("a"), 60_000, () -> { loads.incrementAndGet(); return envelope("x"); });
        off.getOrLoad(key("a"), 60_000, () -> { loads.incrementAndGet(); return envelope("x"); });

        assertEquals(2, loads.get());
    }
}
