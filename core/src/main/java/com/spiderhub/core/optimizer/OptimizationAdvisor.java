package com.spiderhub.core.optimizer;

import com.spiderhub.core.cache.CacheStats;
import com.spiderhub.core.config.EngineConfig;
import com.spiderhub.core.engine.EngineStats;
import com.spiderhub.services.stats.StatisticsManager;
import com.spiderhub.services.stats.StatisticsManager.CallStats;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the collected statistics into operator hints.
 */
public class OptimizationAdvisor {
    static final long MIN_CACHE_LOOKUPS = 20;
    static final double LOW_HIT_RATE = 0.3;
    private static final int SITE_SAMPLE_FLOOR = 3;

    private final EngineConfig config;

    public OptimizationAdvisor(EngineConfig config) {
        this.config = config;
    }

    public List<String> suggestions(ReliabilityOptimizer optimizer, EngineStats engineStats, CacheStats cacheStats) {
        List<String> out = new ArrayList<>();

        for (Map.Entry<String, CallStats> e : optimizer.getStatistics().getAllSites().entrySet()) {
            String site = e.getKey();
            CallStats s = e.getValue();
            if (s.calls() < SITE_SAMPLE_FLOOR) continue;

            if (s.avgDurationMs() > config.slowCallThresholdMs) {
                out.add(String.format("Site %s is slow (avg %dms over %d calls); consider a longer timeout or disabling it",
                        site, s.avgDurationMs(), s.calls()));
            }
            if (s.errorRate() > config.errorRateThreshold) {
                out.add(String.format("Site %s has a high error rate (%.0f%%); check its API or rules",
                        site, s.errorRate() * 100));
            }
        }

        optimizer.healthStates().forEach((site, state) -> {
            if (state == HealthState.DEGRADED) {
                out.add("Site " + site + " is degraded; its timeout is shortened until it recovers");
            }
        });

        Map<String, EngineStats.Demotion> latest = new LinkedHashMap<>();
        engineStats.getDemotions().forEach(d -> latest.put(d.siteKey(), d));
        for (EngineStats.Demotion d : latest.values()) {
            out.add("Site " + d.siteKey() + " fell back from the " + d.preferred()
                    + " backend to default rules: " + d.reason());
        }

        long lookups = cacheStats.memoryHits() + cacheStats.diskHits() + cacheStats.misses();
        if (lookups >= MIN_CACHE_LOOKUPS && cacheStats.hitRate() < LOW_HIT_RATE) {
            out.add(String.format("Cache hit rate is low (%.0f%% of %d lookups); consider longer TTLs",
                    cacheStats.hitRate() * 100, lookups));
        }
        return out;
    }
}
