package com.spiderhub.core.hook;

import com.spiderhub.common.util.RecentErrors;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Execution counters of a single hook.
 */
public class HookStats {
    private final String hookName;
    private final AtomicLong successCount = new AtomicLong();
    private final AtomicLong failureCount = new AtomicLong();
    private final AtomicLong skipCount = new AtomicLong();
    private final AtomicLong totalDurationMs = new AtomicLong();
    private volatile long lastUsed;
    private final RecentErrors recentErrors = new RecentErrors();

    public record Snapshot(String hook, long success, long failure, long skip, long avgDurationMs,
                           long lastUsed, List<String> recentErrors) {
    }

    public HookStats(String hookName) {
        this.hookName = hookName;
    }

    void recordSuccess(long durationMs) {
        successCount.incrementAndGet();
        touch(durationMs);
    }

    void recordSkip(long durationMs) {
        skipCount.incrementAndGet();
        touch(durationMs);
    }

    void recordFailure(String error, long durationMs) {
        failureCount.incrementAndGet();
        recentErrors.add(error);
        touch(durationMs);
    }

    private void touch(long durationMs) {
        totalDurationMs.addAndGet(durationMs);
        lastUsed = System.currentTimeMillis();
    }

    public long getSuccessCount() { return successCount.get(); }
    public long getFailureCount() { return failureCount.get(); }
    public long getSkipCount() { return skipCount.get(); }

    public Snapshot snapshot() {
        long runs = successCount.get() + failureCount.get() + skipCount.get();
        long avg = runs == 0 ? 0 : totalDurationMs.get() / runs;
        return new Snapshot(hookName, successCount.get(), failureCount.get(), skipCount.get(), avg,
                lastUsed, recentErrors.snapshot());
    }
}
