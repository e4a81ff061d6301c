package com.spiderhub.services.database;

import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * DatabaseService - embedded H2 store backing the persistent cache tier.
 */
public class DatabaseService {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseService.class);
    private final Jdbi jdbi;
    private final String url;

    public DatabaseService(String url) {
        this.url = url;
        this.jdbi = Jdbi.create(url);
        logger.info("🗄️ Database initialized: {}", url);
        initializeSchema();
    }

    /**
     * H2 file database under {@code dbPath}. The parent directory is created if needed.
     */
    public static DatabaseService file(String dbPath) {
        File parent = new File(dbPath).getAbsoluteFile().getParentFile();
        if (parent != null) parent.mkdirs();

        // Use ./ prefix for explicit relative paths (required by H2 2.2.224+)
        String prefix = new File(dbPath).isAbsolute() ? "" : "./";
        String url = "jdbc:h2:" + prefix + dbPath +
                ";DB_CLOSE_DELAY=-1" + // Keep DB open
                ";CACHE_SIZE=8192" + // 8MB page cache
                ";DATABASE_TO_UPPER=FALSE" + // Case-sensitive names
                ";AUTO_SERVER=TRUE"; // Allow multiple connections
        return new DatabaseService(url);
    }

    /**
     * Private in-memory database, kept open until the JVM exits.
     */
    public static DatabaseService inMemory(String name) {
        return new DatabaseService("jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1;DATABASE_TO_UPPER=FALSE");
    }

    private void initializeSchema() {
        jdbi.useHandle(handle -> {
            handle.execute("""
                        CREATE TABLE IF NOT EXISTS cache_entries (
                            cache_key VARCHAR(1024) PRIMARY KEY,
                            payload CLOB NOT NULL,
                            created_at BIGINT NOT NULL,
                            ttl_ms BIGINT NOT NULL,
                            last_access BIGINT NOT NULL,
                            size_bytes INT NOT NULL
                        )
                    """);

            handle.execute("CREATE INDEX IF NOT EXISTS idx_cache_created ON cache_entries(created_at)");

            logger.info("✅ Database schema initialized");
        });
    }

    /**
     * Get JDBI instance for custom queries
     */
    public Jdbi getJdbi() {
        return jdbi;
    }

    public String getUrl() {
        return url;
    }

    /**
     * Shutdown database cleanly
     */
    public void shutdown() {
        try {
            jdbi.useHandle(handle -> handle.execute("SHUTDOWN"));
            logger.info("🗄️ Database closed: {}", url);
        } catch (Exception e) {
            logger.warn("Database shutdown failed: {}", e.getMessage());
        }
    }
}
