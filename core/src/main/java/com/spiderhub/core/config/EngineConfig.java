package com.spiderhub.core.config;

import com.spiderhub.common.model.OperationType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine tunables. Plain public fields so Gson can read and write the file as-is;
 * anything missing from the file keeps the default below.
 */
public class EngineConfig {
    // --- Execution ---
    public long defaultTimeoutMs = 15000;
    public long queryDeadlineMs = 30000;
    public int workerThreads = 0; // 0 = 2 x CPU cores
    public int perSiteConcurrency = 3;
    public long backendRetryCooldownMs = 60000;

    // --- Quick search ---
    public double quickTimeoutFactor = 0.5;
    public int quickResultLimit = 10;

    // --- Retry ---
    public int maxRetries = 3;
    public long retryBaseDelayMs = 500;
    public long retryMaxDelayMs = 4000;

    // --- Health ---
    public long slowCallThresholdMs = 5000;
    public double errorRateThreshold = 0.3;
    public int healthWindow = 20;
    public int healthMinSamples = 5;
    public double degradedTimeoutFactor = 0.5;

    // --- Hooks ---
    public long hookTimeoutMs = 10000;
    public boolean builtInHooks = true;
    public String userAgent = "";
    public Map<String, String> userAgentByHost = new HashMap<>();
    public Map<String, String> refererByHost = new HashMap<>();
    public List<String> tlsHostMarkers = new ArrayList<>();

    // --- Cache ---
    public boolean cacheEnabled = true;
    public long memoryCacheMaxEntries = 1000;
    public long memoryCacheMaxBytes = 32L * 1024 * 1024;
    public boolean diskCacheEnabled = true;
    public String diskCachePath = "cache/spiderhub";
    // oldest rows by creation time are evicted past this
    public long diskCacheMaxEntries = 10_000;
    // 0 disables the background purge of expired rows
    public long diskCachePurgeIntervalMs = 10 * 60 * 1000L;
    // seconds, keyed by operation (home, category, search, detail, player)
    public Map<String, Long> cacheTtlSeconds = new HashMap<>();

    // --- Modules ---
    public String moduleDir = "modules";

    public EngineConfig() {
        cacheTtlSeconds.put("home", 600L);
        cacheTtlSeconds.put("category", 300L);
        cacheTtlSeconds.put("search", 180L);
        cacheTtlSeconds.put("detail", 1800L);
        cacheTtlSeconds.put("player", 15L);
    }

    public long getTtlMs(OperationType type) {
        Long seconds = cacheTtlSeconds == null ? null : cacheTtlSeconds.get(type.key());
        if (seconds == null) {
            seconds = new EngineConfig().cacheTtlSeconds.get(type.key());
        }
        return Math.max(0L, seconds) * 1000L;
    }

    public int resolveWorkerThreads() {
        return workerThreads > 0 ? workerThreads : Math.max(2, Runtime.getRuntime().availableProcessors() * 2);
    }
}
