package com.spiderhub.core.hook;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ordered list of hooks for one phase. Order is priority ascending, then
 * registration order. Running a chain never throws: a failing or slow hook is
 * recorded and the value it received passes on unchanged.
 */
public class HookChain<T extends HookValue<T>> {
    private static final Logger logger = LoggerFactory.getLogger(HookChain.class);

    private record Registration<T extends HookValue<T>>(Hook<T> hook, long sequence) {
    }

    private final HookPhase phase;
    private final ExecutorService executor;
    private final long timeoutMs;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, HookStats> stats = new ConcurrentHashMap<>();
    private volatile List<Registration<T>> hooks = List.of();

    public HookChain(HookPhase phase, ExecutorService executor, long timeoutMs) {
        this.phase = phase;
        this.executor = executor;
        this.timeoutMs = timeoutMs;
    }

    public synchronized void register(Hook<T> hook) {
        List<Registration<T>> next = new ArrayList<>(hooks);
        next.removeIf(r -> r.hook().getName().equals(hook.getName()));
        next.add(new Registration<>(hook, sequence.incrementAndGet()));
        next.sort(Comparator.<Registration<T>>comparingInt(r -> r.hook().getPriority())
                .thenComparingLong(Registration::sequence));
        hooks = List.copyOf(next);
        logger.debug("Hook registered: {} [{}] priority {}", hook.getName(), phase, hook.getPriority());
    }

    public synchronized boolean unregister(String name) {
        List<Registration<T>> next = new ArrayList<>(hooks);
        boolean removed = next.removeIf(r -> r.hook().getName().equals(name));
        hooks = List.copyOf(next);
        return removed;
    }

    public List<Hook<T>> getHooks() {
        return hooks.stream().map(Registration::hook).toList();
    }

    public HookPhase getPhase() {
        return phase;
    }

    public T run(T input, HookContext context) {
        T current = input;
        for (Registration<T> registration : hooks) {
            Hook<T> hook = registration.hook();
            if (Thread.currentThread().isInterrupted()) {
                logger.debug("{} chain interrupted before {}", phase, hook.getName());
                return current;
            }
            if (!hook.isEnabled() || !safeMatches(hook, context)) {
                continue;
            }

            HookStats hookStats = stats.computeIfAbsent(hook.getName(), HookStats::new);
            T working = current.copy();
            long start = System.currentTimeMillis();
            Future<HookResult<T>> future = executor.submit(() -> hook.execute(working, context));
            try {
                HookResult<T> result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
                long took = System.currentTimeMillis() - start;

                if (result instanceof HookResult.Success<T> success) {
                    hookStats.recordSuccess(took);
                    if (success.value() != null) current = success.value();
                } else if (result instanceof HookResult.Stop<T> stop) {
                    hookStats.recordSuccess(took);
                    logger.debug("Hook {} stopped the {} chain", hook.getName(), phase);
                    return stop.value() != null ? stop.value() : current;
                } else if (result instanceof HookResult.Failure<T> failure) {
                    hookStats.recordFailure(failure.error(), took);
                    logger.warn("Hook {} failed: {}", hook.getName(), failure.error());
                } else {
                    hookStats.recordSkip(took);
                }
            } catch (TimeoutException e) {
                future.cancel(true);
                hookStats.recordFailure("timeout", System.currentTimeMillis() - start);
                logger.warn("⏱️ Hook {} timed out after {} ms", hook.getName(), timeoutMs);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                hookStats.recordFailure(cause.getClass().getSimpleName() + ": " + cause.getMessage(),
                        System.currentTimeMillis() - start);
                logger.warn("Hook {} threw {}", hook.getName(), cause.toString());
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                return current;
            }
        }
        return current;
    }

    private boolean safeMatches(Hook<T> hook, HookContext context) {
        try {
            return hook.matches(context);
        } catch (RuntimeException e) {
            logger.warn("Hook {} matcher threw {}", hook.getName(), e.toString());
            stats.computeIfAbsent(hook.getName(), HookStats::new).recordFailure("matches: " + e.getMessage(), 0);
            return false;
        }
    }

    public Map<String, HookStats.Snapshot> stats() {
        Map<String, HookStats.Snapshot> out = new ConcurrentHashMap<>();
        stats.forEach((name, s) -> out.put(name, s.snapshot()));
        return out;
    }

    public HookStats getStats(String hookName) {
        return stats.get(hookName);
    }

    public void clearStats() {
        stats.clear();
    }
}
