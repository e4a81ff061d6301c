package com.spiderhub.core.cache;

import com.google.gson.Gson;
import com.spiderhub.common.model.ContentEnvelope;
import com.spiderhub.common.model.EnvelopeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Two-tier envelope cache with request collapsing.
 * <p>
 * Lookups go memory first, then disk; a disk hit is promoted into memory. Only
 * successful envelopes are stored. Concurrent {@link #getOrLoad} calls for the same
 * missing key run the loader once and share its result.
 */
public class ResultCache {
    private static final Logger logger = LoggerFactory.getLogger(ResultCache.class);

    @FunctionalInterface
    public interface Loader {
        ContentEnvelope load() throws InterruptedException;
    }

    private final MemoryCacheTier memory;
    private final DiskCacheTier disk;
    private final LongSupplier clock;
    private final boolean enabled;
    private final Gson gson = new Gson();
    private final ConcurrentHashMap<String, CompletableFuture<ContentEnvelope>> inflight = new ConcurrentHashMap<>();

    private final AtomicLong memoryHits = new AtomicLong();
    private final AtomicLong diskHits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong puts = new AtomicLong();
    private final AtomicLong loads = new AtomicLong();
    private final AtomicLong sharedLoads = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    /**
     * @param disk may be null for a memory-only cache
     */
    public ResultCache(MemoryCacheTier memory, DiskCacheTier disk, LongSupplier clock, boolean enabled) {
        this.memory = memory;
        this.disk = disk;
        this.clock = clock;
        this.enabled = enabled;
    }

    public CacheLookup get(CacheKey key) {
        if (!enabled) return CacheLookup.MISS;
        String k = key.asString();

        CacheEntry entry = memory.get(k);
        if (entry != null) {
            ContentEnvelope value = decode(entry);
            if (value != null) {
                memoryHits.incrementAndGet();
                return new CacheLookup.Hit(value, CacheTier.MEMORY);
            }
        }

        if (disk != null) {
            entry = disk.get(k);
            if (entry != null) {
                ContentEnvelope value = decode(entry);
                if (value != null) {
                    memory.put(entry.inTier(CacheTier.MEMORY));
                    diskHits.incrementAndGet();
                    logger.debug("Promoted {} from disk", k);
                    return new CacheLookup.Hit(value, CacheTier.DISK);
                }
            }
        }

        misses.incrementAndGet();
        return CacheLookup.MISS;
    }

    /**
     * Stores a successful envelope. Failed envelopes and non-positive TTLs are ignored.
     */
    public void put(CacheKey key, ContentEnvelope value, long ttlMs) {
        if (!enabled || ttlMs <= 0 || value == null || !value.isCacheable()) return;

        String payload;
        try {
            payload = gson.toJson(value);
        } catch (RuntimeException e) {
            errors.incrementAndGet();
            logger.warn("Could not serialize envelope for {}: {}", key, e.getMessage());
            return;
        }

        CacheEntry entry = new CacheEntry(key.asString(), payload, clock.getAsLong(), ttlMs, CacheTier.MEMORY);
        memory.put(entry);
        if (disk != null && !disk.put(entry.inTier(CacheTier.DISK))) {
            errors.incrementAndGet();
        }
        puts.incrementAndGet();
    }

    /**
     * Drops every entry whose key starts with {@code prefix} from both tiers.
     */
    public int invalidate(String prefix) {
        int removed = memory.invalidatePrefix(prefix);
        if (disk != null) removed += disk.invalidatePrefix(prefix);
        logger.info("🧹 Cache invalidated: {} ({} entries)", prefix, removed);
        return removed;
    }

    /**
     * Returns the cached value, or runs {@code loader} once for all concurrent callers of
     * the same key. The leader runs the loader on its own thread, so interrupting it
     * cancels the load; a cancelled or interrupted load is never stored and followers
     * that were not themselves cancelled retry as the new leader.
     *
     * @throws InterruptedException if this caller was interrupted while waiting on a leader
     */
    public ContentEnvelope getOrLoad(CacheKey key, long ttlMs, Loader loader) throws InterruptedException {
        CacheLookup lookup = get(key);
        if (lookup instanceof CacheLookup.Hit hit) {
            return hit.value();
        }

        String k = key.asString();
        while (true) {
            CompletableFuture<ContentEnvelope> created = new CompletableFuture<>();
            CompletableFuture<ContentEnvelope> existing = inflight.putIfAbsent(k, created);

            if (existing != null) {
                sharedLoads.incrementAndGet();
                ContentEnvelope shared = await(existing);
                if (shared.getStatus() == EnvelopeStatus.CANCELLED && !Thread.currentThread().isInterrupted()) {
                    continue;
                }
                return shared;
            }

            loads.incrementAndGet();
            ContentEnvelope result = null;
            try {
                // a previous leader may have stored the value between our lookup and putIfAbsent
                CacheEntry fresh = enabled ? memory.get(k) : null;
                ContentEnvelope stored = fresh != null ? decode(fresh) : null;
                if (stored != null) {
                    result = stored;
                    return result;
                }

                result = loader.load();
                if (!Thread.currentThread().isInterrupted() && result.getStatus() != EnvelopeStatus.CANCELLED) {
                    put(key, result, ttlMs);
                }
                return result;
            } finally {
                inflight.remove(k, created);
                created.complete(result != null ? result : ContentEnvelope.cancelled());
            }
        }
    }

    private ContentEnvelope await(CompletableFuture<ContentEnvelope> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            errors.incrementAndGet();
            return ContentEnvelope.cancelled();
        }
    }

    /**
     * Removes expired rows from the disk tier. Memory entries expire on their own.
     */
    public int purgeExpired() {
        return disk == null ? 0 : disk.purgeExpired();
    }

    public void clear() {
        memory.clear();
        if (disk != null) disk.clear();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public CacheStats stats() {
        return new CacheStats(memory.size(), memory.weightedBytes(), disk == null ? 0 : disk.count(),
                memoryHits.get(), diskHits.get(), misses.get(), puts.get(),
                loads.get(), sharedLoads.get(), errors.get());
    }

    public void resetStats() {
        memoryHits.set(0);
        diskHits.set(0);
        misses.set(0);
        puts.set(0);
        loads.set(0);
        sharedLoads.set(0);
        errors.set(0);
    }

    private ContentEnvelope decode(CacheEntry entry) {
        try {
            ContentEnvelope value = gson.fromJson(entry.getPayload(), ContentEnvelope.class);
            if (value == null) throw new IllegalStateException("empty payload");
            return value;
        } catch (RuntimeException e) {
            errors.incrementAndGet();
            logger.warn("Corrupt cache entry {}: {}", entry.getKey(), e.getMessage());
            return null;
        }
    }
}
