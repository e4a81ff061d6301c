package com.spiderhub.core;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.spiderhub.core.aggregate.ConcurrentAggregator;
import com.spiderhub.core.cache.CacheStats;
import com.spiderhub.core.engine.EngineStats;
import com.spiderhub.core.hook.HookStats;
import com.spiderhub.core.optimizer.HealthState;
import com.spiderhub.services.stats.StatisticsManager.CallStats;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of every counter the engine keeps.
 */
public record EngineSnapshot(EngineStats.Snapshot engine,
                             Map<String, HookStats.Snapshot> hook,
                             CacheStats cache,
                             ConcurrentAggregator.Stats aggregator,
                             Map<String, SitePerformance> performance) {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public record SitePerformance(CallStats calls, HealthState health, double errorRate, List<String> recentErrors) {
    }

    public String toJson() {
        return GSON.toJson(this);
    }
}
