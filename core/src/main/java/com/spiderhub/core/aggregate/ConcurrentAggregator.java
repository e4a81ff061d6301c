package com.spiderhub.core.aggregate;

import com.spiderhub.common.error.ConfigException;
import com.spiderhub.common.error.ErrorKind;
import com.spiderhub.common.model.ContentEnvelope;
import com.spiderhub.common.model.EnvelopeStatus;
import com.spiderhub.common.model.Operation;
import com.spiderhub.common.model.Site;
import com.spiderhub.core.config.EngineConfig;
import com.spiderhub.core.optimizer.ReliabilityOptimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Fans one operation out over many sites on a bounded worker pool.
 * <p>
 * Each site call gets its own timeout, started when a worker picks it up, and the whole
 * query a deadline. Timeouts, the deadline and {@link AggregateQuery#cancel()} interrupt
 * the worker; the interrupted call is never written to the cache.
 */
public class ConcurrentAggregator {
    private static final Logger logger = LoggerFactory.getLogger(ConcurrentAggregator.class);

    public record Stats(long queries, long completed, long cancelled, int active,
                        long siteCalls, long siteTimeouts, long queueTimeouts, int workerThreads) {
    }

    private final EngineConfig config;
    private final ReliabilityOptimizer optimizer;
    private final ThreadPoolExecutor workers;
    private final ScheduledExecutorService timer;

    private final AtomicInteger queryIds = new AtomicInteger();
    private final AtomicLong queries = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong cancelledQueries = new AtomicLong();
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicLong siteCalls = new AtomicLong();
    private final AtomicLong siteTimeouts = new AtomicLong();
    private final AtomicLong queueTimeouts = new AtomicLong();

    public ConcurrentAggregator(EngineConfig config, ReliabilityOptimizer optimizer) {
        this.config = config;
        this.optimizer = optimizer;

        int threads = config.resolveWorkerThreads();
        AtomicInteger workerCount = new AtomicInteger();
        this.workers = new ThreadPoolExecutor(threads, threads, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), r -> {
            Thread t = new Thread(r, "Aggregator-" + workerCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.workers.allowCoreThreadTimeOut(true);

        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "Aggregator-Timer");
            t.setDaemon(true);
            return t;
        });
        scheduler.setRemoveOnCancelPolicy(true);
        this.timer = scheduler;

        logger.info("⚙️ Aggregator started with {} workers", threads);
    }

    /**
     * Searches all searchable sites (quick-searchable ones in quick mode). Quick mode
     * shortens each site's timeout and truncates its items.
     */
    public AggregateQuery search(List<Site> sites, String keyword, boolean quick, AggregateListener listener) {
        Operation.Search operation = new Operation.Search(keyword, quick);
        List<Site> eligible = new ArrayList<>();
        for (Site site : sites) {
            if (!site.isSearchable() || (quick && !site.isQuickSearchable())) {
                logger.debug("Skipping {} for search", site.getKey());
                continue;
            }
            eligible.add(site);
        }
        logger.info("🔎 Searching '{}' on {} sites{}", operation.keyword(),
                eligible.size(), quick ? " (quick)" : "");
        return fanOut(eligible, site -> operation, quick, listener);
    }

    public AggregateQuery aggregateHome(List<Site> sites, AggregateListener listener) {
        Operation operation = new Operation.Home(true);
        logger.info("🏠 Loading home on {} sites", sites.size());
        return fanOut(sites, site -> operation, false, listener);
    }

    /**
     * Runs a per-site operation over all given sites.
     */
    public AggregateQuery fanOut(List<Site> sites, Function<Site, Operation> operationFor, boolean quick,
                                 AggregateListener listener) {
        String id = "q" + queryIds.incrementAndGet();
        queries.incrementAndGet();
        active.incrementAndGet();

        AggregateQuery query = new AggregateQuery(id, sites, listener, q -> {
            active.decrementAndGet();
            completed.incrementAndGet();
            if (q.isCancelled()) cancelledQueries.incrementAndGet();
        });

        if (query.size() == 0) {
            query.finishIfEmpty();
            return query;
        }
        if (workers.isShutdown()) {
            query.abortPending(EnvelopeStatus.CANCELLED, "engine is shut down");
            return query;
        }

        try {
            query.setDeadline(timer.schedule(
                    () -> query.abortPending(EnvelopeStatus.TIMED_OUT, "query deadline exceeded"),
                    config.queryDeadlineMs, TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            query.abortPending(EnvelopeStatus.CANCELLED, "engine is shut down");
            return query;
        }

        for (AggregateQuery.Slot slot : query.slots()) {
            ContentEnvelope rejected = rejectInvalid(slot.site);
            if (rejected != null) {
                query.complete(slot, rejected);
                continue;
            }
            Operation operation = operationFor.apply(slot.site);
            long timeoutMs = optimizer.effectiveTimeoutMs(slot.site, quick);
            try {
                slot.future = workers.submit(() -> runSlot(query, slot, operation, timeoutMs, quick));
            } catch (RejectedExecutionException e) {
                // shut down after the check above
                query.complete(slot, ContentEnvelope.cancelled());
                continue;
            }
            if (slot.done.get()) {
                // cancelled or expired before the future was published
                slot.future.cancel(true);
            }
        }
        return query;
    }

    private void runSlot(AggregateQuery query, AggregateQuery.Slot slot, Operation operation,
                         long timeoutMs, boolean quick) {
        if (slot.done.get()) return;
        siteCalls.incrementAndGet();
        slot.startedAt = System.currentTimeMillis();
        try {
            slot.timer = scheduleSlotTimeout(query, slot, operation, timeoutMs);
        } catch (RejectedExecutionException e) {
            query.complete(slot, ContentEnvelope.cancelled());
            return;
        }
        if (slot.done.get()) {
            slot.timer.cancel(false);
            return;
        }

        ContentEnvelope envelope;
        try {
            envelope = optimizer.execute(slot.site, operation);
            if (quick) envelope = envelope.truncated(config.quickResultLimit);
        } catch (InterruptedException e) {
            envelope = ContentEnvelope.cancelled();
        } catch (RuntimeException e) {
            logger.error("Unexpected failure on {}", slot.site.getKey(), e);
            envelope = ContentEnvelope.failed(ErrorKind.INTERNAL, e.toString());
        }
        query.complete(slot, envelope);
    }

    private Future<?> scheduleSlotTimeout(AggregateQuery query, AggregateQuery.Slot slot, Operation operation,
                                          long timeoutMs) {
        return timer.schedule(() -> {
            if (query.complete(slot, ContentEnvelope.timedOut(slot.site.getKey() + " timed out after " + timeoutMs + "ms"))) {
                siteTimeouts.incrementAndGet();
                optimizer.recordTimeout(slot.site, operation, System.currentTimeMillis() - slot.startedAt);
                logger.warn("⏱️ {} timed out after {}ms", slot.site.getKey(), timeoutMs);
                Future<?> f = slot.future;
                if (f != null) f.cancel(true);
            }
        }, timeoutMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Runs a single site call on the worker pool. The site's timeout starts when a worker
     * picks the call up; a call still queued when the query deadline passes times out
     * without counting against the site. A caller interrupt cancels the call and is
     * restored before returning.
     */
    public ContentEnvelope executeOne(Site site, Operation operation) {
        ContentEnvelope rejected = rejectInvalid(site);
        if (rejected != null) return rejected;
        long timeoutMs = optimizer.effectiveTimeoutMs(site, false);
        CompletableFuture<Long> startedAt = new CompletableFuture<>();
        Future<ContentEnvelope> future;
        try {
            future = workers.submit(() -> {
                startedAt.complete(System.currentTimeMillis());
                try {
                    return optimizer.execute(site, operation);
                } catch (InterruptedException e) {
                    return ContentEnvelope.cancelled();
                }
            });
        } catch (RejectedExecutionException e) {
            return ContentEnvelope.cancelled();
        }

        long began;
        try {
            began = startedAt.get(config.queryDeadlineMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            queueTimeouts.incrementAndGet();
            logger.warn("⏳ {} {} still queued after {}ms", site.getKey(), operation.type().key(), config.queryDeadlineMs);
            return ContentEnvelope.timedOut(site.getKey() + " was not started within " + config.queryDeadlineMs + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ContentEnvelope.cancelled();
        } catch (ExecutionException e) {
            // startedAt is only ever completed normally
            throw new IllegalStateException(e.getCause());
        }
        siteCalls.incrementAndGet();

        long remainingMs = Math.max(1L, timeoutMs - (System.currentTimeMillis() - began));
        try {
            return future.get(remainingMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            siteTimeouts.incrementAndGet();
            optimizer.recordTimeout(site, operation, System.currentTimeMillis() - began);
            logger.warn("⏱️ {} {} timed out after {}ms", site.getKey(), operation.type().key(), timeoutMs);
            return ContentEnvelope.timedOut(site.getKey() + " timed out after " + timeoutMs + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ContentEnvelope.cancelled();
        } catch (CancellationException e) {
            return ContentEnvelope.cancelled();
        } catch (ExecutionException e) {
            logger.error("Unexpected failure on {}", site.getKey(), e.getCause());
            return ContentEnvelope.failed(ErrorKind.INTERNAL, String.valueOf(e.getCause()));
        }
    }

    /**
     * A broken site definition fails that site only.
     */
    private static ContentEnvelope rejectInvalid(Site site) {
        try {
            site.validate();
            return null;
        } catch (ConfigException e) {
            logger.error("❌ Site rejected: {}", e.getMessage());
            return ContentEnvelope.failed(ErrorKind.CONFIG, e.getMessage());
        }
    }

    public Stats stats() {
        return new Stats(queries.get(), completed.get(), cancelledQueries.get(), active.get(),
                siteCalls.get(), siteTimeouts.get(), queueTimeouts.get(), workers.getMaximumPoolSize());
    }

    /**
     * Zeroes the counters; queries still running keep counting as active.
     */
    public void resetStats() {
        queries.set(0);
        completed.set(0);
        cancelledQueries.set(0);
        siteCalls.set(0);
        siteTimeouts.set(0);
        queueTimeouts.set(0);
    }

    public void shutdown() {
        timer.shutdownNow();
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Aggregator workers did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("🛑 Aggregator stopped");
    }
}
