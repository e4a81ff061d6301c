package com.spiderhub.services.stats;

import com.spiderhub.common.model.OperationType;
import com.spiderhub.common.util.RecentErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Call statistics per site and operation, plus the last few errors of each site.
 */
public class StatisticsManager {
    private static final Logger logger = LoggerFactory.getLogger(StatisticsManager.class);

    public record CallStats(long calls, long successes, long failures, long timeouts, long slowCalls,
                            long totalDurationMs, long maxDurationMs, long lastActivity) {

        static final CallStats EMPTY = new CallStats(0, 0, 0, 0, 0, 0, 0, 0);

        public long avgDurationMs() {
            return calls == 0 ? 0 : totalDurationMs / calls;
        }

        public double errorRate() {
            return calls == 0 ? 0.0 : (double) (failures + timeouts) / calls;
        }

        CallStats plus(CallStats o) {
            return new CallStats(calls + o.calls, successes + o.successes, failures + o.failures,
                    timeouts + o.timeouts, slowCalls + o.slowCalls, totalDurationMs + o.totalDurationMs,
                    Math.max(maxDurationMs, o.maxDurationMs), Math.max(lastActivity, o.lastActivity));
        }
    }

    public enum Outcome { SUCCESS, FAILURE, TIMEOUT }

    private final Map<String, CallStats> stats = new ConcurrentHashMap<>();
    private final Map<String, RecentErrors> recentErrors = new ConcurrentHashMap<>();

    public void record(String siteKey, OperationType type, long durationMs, Outcome outcome, boolean slow) {
        long now = System.currentTimeMillis();
        stats.compute(key(siteKey, type), (k, v) -> {
            CallStats s = v == null ? CallStats.EMPTY : v;
            return new CallStats(s.calls() + 1,
                    s.successes() + (outcome == Outcome.SUCCESS ? 1 : 0),
                    s.failures() + (outcome == Outcome.FAILURE ? 1 : 0),
                    s.timeouts() + (outcome == Outcome.TIMEOUT ? 1 : 0),
                    s.slowCalls() + (slow ? 1 : 0),
                    s.totalDurationMs() + durationMs,
                    Math.max(s.maxDurationMs(), durationMs),
                    now);
        });
        if (slow) {
            logger.warn("🐢 Slow {} call on {}: {}ms", type.key(), siteKey, durationMs);
        }
    }

    public void recordError(String siteKey, String message) {
        recentErrors.computeIfAbsent(siteKey, k -> new RecentErrors()).add(message);
    }

    public CallStats get(String siteKey, OperationType type) {
        return stats.getOrDefault(key(siteKey, type), CallStats.EMPTY);
    }

    /**
     * All operations of one site folded together.
     */
    public CallStats getSiteStats(String siteKey) {
        String prefix = siteKey + "|";
        return stats.entrySet().stream()
                .filter(e -> e.getKey().startsWith(prefix))
                .map(Map.Entry::getValue)
                .reduce(CallStats.EMPTY, CallStats::plus);
    }

    public Map<String, CallStats> getAllSites() {
        return stats.keySet().stream()
                .map(k -> k.substring(0, k.lastIndexOf('|')))
                .distinct()
                .sorted()
                .collect(Collectors.toMap(k -> k, this::getSiteStats, (a, b) -> a, LinkedHashMap::new));
    }

    public Map<String, CallStats> getSlowestSites(int limit) {
        return getAllSites().entrySet().stream()
                .sorted((e1, e2) -> Long.compare(e2.getValue().avgDurationMs(), e1.getValue().avgDurationMs()))
                .limit(limit)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (e1, e2) -> e1, LinkedHashMap::new));
    }

    public List<String> getRecentErrors(String siteKey) {
        RecentErrors errors = recentErrors.get(siteKey);
        return errors == null ? List.of() : errors.snapshot();
    }

    public long getTotalCalls() {
        return stats.values().stream().mapToLong(CallStats::calls).sum();
    }

    public void clear() {
        stats.clear();
        recentErrors.clear();
    }

    private static String key(String siteKey, OperationType type) {
        return siteKey + "|" + type.key();
    }
}
