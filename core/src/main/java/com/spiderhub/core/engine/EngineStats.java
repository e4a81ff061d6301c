package com.spiderhub.core.engine;

import com.spiderhub.common.util.RecentErrors;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-backend call counters, per-site upstream call counts and the demotion log.
 */
public class EngineStats {

    public record Demotion(String siteKey, BackendType preferred, String reason, long at) {
    }

    public record BackendSnapshot(BackendType backend, long calls, long success, long failure,
                                  long avgDurationMs, long lastUsed, List<String> recentErrors) {
    }

    public record Snapshot(Map<BackendType, BackendSnapshot> backends, Map<String, Long> upstreamCalls,
                           List<Demotion> demotions) {
    }

    private static class Counter {
        final AtomicLong success = new AtomicLong();
        final AtomicLong failure = new AtomicLong();
        final AtomicLong totalDurationMs = new AtomicLong();
        volatile long lastUsed;
        final RecentErrors recentErrors = new RecentErrors();
    }

    private final Map<BackendType, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> upstreamCalls = new ConcurrentHashMap<>();
    private final List<Demotion> demotions = new CopyOnWriteArrayList<>();

    public void recordCall(String siteKey) {
        upstreamCalls.computeIfAbsent(siteKey, k -> new AtomicLong()).incrementAndGet();
    }

    public void recordSuccess(BackendType type, long durationMs) {
        Counter c = counter(type);
        c.success.incrementAndGet();
        c.totalDurationMs.addAndGet(durationMs);
        c.lastUsed = System.currentTimeMillis();
    }

    public void recordFailure(BackendType type, long durationMs, String error) {
        Counter c = counter(type);
        c.failure.incrementAndGet();
        c.totalDurationMs.addAndGet(durationMs);
        c.lastUsed = System.currentTimeMillis();
        c.recentErrors.add(error);
    }

    public void recordDemotion(String siteKey, BackendType preferred, String reason) {
        demotions.add(new Demotion(siteKey, preferred, reason, System.currentTimeMillis()));
    }

    /**
     * Backend invocations issued for a site (cache hits do not count).
     */
    public long getUpstreamCalls(String siteKey) {
        AtomicLong n = upstreamCalls.get(siteKey);
        return n == null ? 0 : n.get();
    }

    public List<Demotion> getDemotions() {
        return new ArrayList<>(demotions);
    }

    public Snapshot snapshot() {
        Map<BackendType, BackendSnapshot> backends = new EnumMap<>(BackendType.class);
        counters.forEach((type, c) -> {
            long calls = c.success.get() + c.failure.get();
            backends.put(type, new BackendSnapshot(type, calls, c.success.get(), c.failure.get(),
                    calls == 0 ? 0 : c.totalDurationMs.get() / calls, c.lastUsed, c.recentErrors.snapshot()));
        });
        Map<String, Long> calls = new ConcurrentHashMap<>();
        upstreamCalls.forEach((k, v) -> calls.put(k, v.get()));
        return new Snapshot(backends, calls, getDemotions());
    }

    public void clear() {
        counters.clear();
        upstreamCalls.clear();
        demotions.clear();
    }

    private Counter counter(BackendType type) {
        return counters.computeIfAbsent(type, t -> new Counter());
    }
}
