package com.spiderhub.core.cache;

import com.spiderhub.services.database.DatabaseService;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Persistent tier in the {@code cache_entries} table, capped at {@code maxEntries} rows
 * (oldest {@code created_at} goes first). Storage errors are logged and reported as
 * misses or no-ops; they never reach the caller.
 */
public class DiskCacheTier {
    private static final Logger logger = LoggerFactory.getLogger(DiskCacheTier.class);

    private final Jdbi jdbi;
    private final LongSupplier clock;
    private final long maxEntries;

    public DiskCacheTier(DatabaseService database, LongSupplier clock, long maxEntries) {
        if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be positive");
        this.jdbi = database.getJdbi();
        this.clock = clock;
        this.maxEntries = maxEntries;
    }

    public CacheEntry get(String key) {
        try {
            long now = clock.getAsLong();
            Optional<CacheEntry> row = jdbi.withHandle(handle -> handle
                    .createQuery("SELECT cache_key, payload, created_at, ttl_ms FROM cache_entries WHERE cache_key = :key")
                    .bind("key", key)
                    .map((rs, ctx) -> new CacheEntry(rs.getString("cache_key"), rs.getString("payload"),
                            rs.getLong("created_at"), rs.getLong("ttl_ms"), CacheTier.DISK))
                    .findOne());

            if (row.isEmpty()) return null;
            CacheEntry entry = row.get();
            if (entry.isExpired(now)) {
                delete(key);
                return null;
            }
            jdbi.useHandle(handle -> handle
                    .createUpdate("UPDATE cache_entries SET last_access = :now WHERE cache_key = :key")
                    .bind("now", now)
                    .bind("key", key)
                    .execute());
            entry.touch(now);
            return entry;
        } catch (Exception e) {
            logger.warn("Disk cache read failed for {}: {}", key, e.getMessage());
            return null;
        }
    }

    public boolean put(CacheEntry entry) {
        try {
            jdbi.useHandle(handle -> handle
                    .createUpdate("""
                                MERGE INTO cache_entries (cache_key, payload, created_at, ttl_ms, last_access, size_bytes)
                                KEY (cache_key)
                                VALUES (:key, :payload, :created, :ttl, :access, :size)
                            """)
                    .bind("key", entry.getKey())
                    .bind("payload", entry.getPayload())
                    .bind("created", entry.getCreatedAt())
                    .bind("ttl", entry.getTtlMs())
                    .bind("access", entry.getLastAccess())
                    .bind("size", entry.getSizeBytes())
                    .execute());
            evictOverflow();
            return true;
        } catch (Exception e) {
            logger.warn("Disk cache write failed for {}: {}", entry.getKey(), e.getMessage());
            return false;
        }
    }

    public int invalidatePrefix(String prefix) {
        try {
            String pattern = prefix.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_") + "%";
            return jdbi.withHandle(handle -> handle
                    .createUpdate("DELETE FROM cache_entries WHERE cache_key LIKE :pattern ESCAPE '\\'")
                    .bind("pattern", pattern)
                    .execute());
        } catch (Exception e) {
            logger.warn("Disk cache invalidation failed for {}: {}", prefix, e.getMessage());
            return 0;
        }
    }

    /**
     * Deletes every row whose TTL has run out.
     */
    public int purgeExpired() {
        try {
            long now = clock.getAsLong();
            int removed = jdbi.withHandle(handle -> handle
                    .createUpdate("DELETE FROM cache_entries WHERE CAST(:now AS BIGINT) - created_at > ttl_ms")
                    .bind("now", now)
                    .execute());
            if (removed > 0) logger.info("🧹 Purged {} expired cache rows", removed);
            return removed;
        } catch (Exception e) {
            logger.warn("Disk cache purge failed: {}", e.getMessage());
            return 0;
        }
    }

    public long count() {
        try {
            return jdbi.withHandle(handle -> handle.createQuery("SELECT COUNT(*) FROM cache_entries")
                    .mapTo(Long.class)
                    .one());
        } catch (Exception e) {
            logger.warn("Disk cache count failed: {}", e.getMessage());
            return 0L;
        }
    }

    public void clear() {
        try {
            jdbi.useHandle(handle -> handle.execute("DELETE FROM cache_entries"));
        } catch (Exception e) {
            logger.warn("Disk cache clear failed: {}", e.getMessage());
        }
    }

    /**
     * Drops the oldest rows until the table is back at its cap.
     *
     * @return rows removed
     */
    int evictOverflow() {
        long excess = count() - maxEntries;
        if (excess <= 0) return 0;
        int removed = jdbi.inTransaction(handle -> {
            List<String> oldest = handle
                    .createQuery("SELECT cache_key FROM cache_entries ORDER BY created_at, cache_key")
                    .setMaxRows((int) Math.min(excess, Integer.MAX_VALUE))
                    .mapTo(String.class)
                    .list();
            if (oldest.isEmpty()) return 0;
            return handle.createUpdate("DELETE FROM cache_entries WHERE cache_key IN (<keys>)")
                    .bindList("keys", oldest)
                    .execute();
        });
        if (removed > 0) logger.debug("Evicted {} disk cache rows over the cap of {}", removed, maxEntries);
        return removed;
    }

    public long getMaxEntries() { return maxEntries; }

    private void delete(String key) {
        jdbi.useHandle(handle -> handle.createUpdate("DELETE FROM cache_entries WHERE cache_key = :key")
                .bind("key", key)
                .execute());
    }
}
