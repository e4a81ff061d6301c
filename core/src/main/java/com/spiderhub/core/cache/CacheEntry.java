package com.spiderhub.core.cache;

/**
 * A serialized envelope plus its timing data. Expired once {@code now - createdAt > ttlMs}.
 */
public class CacheEntry {
    private final String key;
    private final String payload;
    private final long createdAt;
    private final long ttlMs;
    private final CacheTier tier;
    private final int sizeBytes;
    private volatile long lastAccess;

    public CacheEntry(String key, String payload, long createdAt, long ttlMs, CacheTier tier) {
        this.key = key;
        this.payload = payload;
        this.createdAt = createdAt;
        this.ttlMs = ttlMs;
        this.tier = tier;
        // UTF-16 in memory; close enough for a bound
        this.sizeBytes = key.length() * 2 + payload.length() * 2 + 64;
        this.lastAccess = createdAt;
    }

    public String getKey() { return key; }
    public String getPayload() { return payload; }
    public long getCreatedAt() { return createdAt; }
    public long getTtlMs() { return ttlMs; }
    public CacheTier getTier() { return tier; }
    public int getSizeBytes() { return sizeBytes; }
    public long getLastAccess() { return lastAccess; }

    public void touch(long now) {
        this.lastAccess = now;
    }

    public boolean isExpired(long now) {
        return now - createdAt > ttlMs;
    }

    public long remainingMs(long now) {
        return Math.max(0L, createdAt + ttlMs - now);
    }

    public CacheEntry inTier(CacheTier target) {
        CacheEntry copy = new CacheEntry(key, payload, createdAt, ttlMs, target);
        copy.lastAccess = lastAccess;
        return copy;
    }
}
