package com.spiderhub.core.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * In-process tier. Bounded by bytes and by entry count at once: every entry weighs at
 * least {@code maxBytes / maxEntries}, so the weight limit also caps the count.
 * Each entry expires at its own creation time plus TTL.
 */
public class MemoryCacheTier {
    private final Cache<String, CacheEntry> cache;
    private final LongSupplier clock;

    public MemoryCacheTier(long maxEntries, long maxBytes, LongSupplier clock) {
        this.clock = clock;
        long entries = Math.max(1L, maxEntries);
        long bytes = Math.max(entries, maxBytes);
        int minWeight = (int) Math.min(Integer.MAX_VALUE, Math.max(1L, bytes / entries));

        Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.getAsLong());
        this.cache = Caffeine.newBuilder()
                .maximumWeight(bytes)
                .weigher((String key, CacheEntry entry) -> Math.max(entry.getSizeBytes(), minWeight))
                .expireAfter(new Expiry<String, CacheEntry>() {
                    @Override
                    public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
                        return TimeUnit.MILLISECONDS.toNanos(entry.remainingMs(clock.getAsLong()));
                    }

                    @Override
                    public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
                        return TimeUnit.MILLISECONDS.toNanos(entry.remainingMs(clock.getAsLong()));
                    }

                    @Override
                    public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    public CacheEntry get(String key) {
        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null) return null;
        long now = clock.getAsLong();
        if (entry.isExpired(now)) {
            cache.invalidate(key);
            return null;
        }
        entry.touch(now);
        return entry;
    }

    public void put(CacheEntry entry) {
        cache.put(entry.getKey(), entry.getTier() == CacheTier.MEMORY ? entry : entry.inTier(CacheTier.MEMORY));
    }

    public int invalidatePrefix(String prefix) {
        int[] removed = { 0 };
        cache.asMap().keySet().removeIf(k -> {
            boolean match = k.startsWith(prefix);
            if (match) removed[0]++;
            return match;
        });
        return removed[0];
    }

    public void clear() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public long weightedBytes() {
        cache.cleanUp();
        return cache.policy().eviction()
                .map(e -> e.weightedSize().orElse(0L))
                .orElse(0L);
    }
}
