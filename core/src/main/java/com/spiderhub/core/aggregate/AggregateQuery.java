package com.spiderhub.core.aggregate;

import com.spiderhub.common.model.ContentEnvelope;
import com.spiderhub.common.model.EnvelopeStatus;
import com.spiderhub.common.model.Site;
import com.spiderhub.common.model.SiteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Handle on one fan-out. Every site slot completes exactly once, whether by result,
 * timeout, deadline or cancellation; the listener's {@code onComplete} fires after the last.
 */
public class AggregateQuery {
    private static final Logger logger = LoggerFactory.getLogger(AggregateQuery.class);

    static final class Slot {
        final Site site;
        final AtomicBoolean done = new AtomicBoolean();
        volatile Future<?> future;
        volatile Future<?> timer;
        volatile long startedAt;

        Slot(Site site) {
            this.site = site;
        }
    }

    private final String id;
    private final AggregateListener listener;
    private final long createdAt = System.currentTimeMillis();
    private final Map<String, Slot> slots = new LinkedHashMap<>();
    private final List<SiteResult> results = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger remaining;
    private final CountDownLatch finished = new CountDownLatch(1);
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile Future<?> deadline;
    private volatile AggregateSummary summary;
    private final Consumer<AggregateQuery> onFinish;

    AggregateQuery(String id, List<Site> sites, AggregateListener listener, Consumer<AggregateQuery> onFinish) {
        this.id = id;
        this.listener = listener == null ? AggregateListener.NONE : listener;
        this.onFinish = onFinish;
        for (Site site : sites) {
            slots.putIfAbsent(site.getKey(), new Slot(site));
        }
        this.remaining = new AtomicInteger(slots.size());
    }

    public String getId() {
        return id;
    }

    Iterable<Slot> slots() {
        return slots.values();
    }

    void setDeadline(Future<?> deadline) {
        this.deadline = deadline;
    }

    /**
     * Completes the slot unless it already is. Returns false when another path won.
     */
    boolean complete(Slot slot, ContentEnvelope envelope) {
        if (!slot.done.compareAndSet(false, true)) {
            return false;
        }
        Future<?> timer = slot.timer;
        if (timer != null) timer.cancel(false);

        long started = slot.startedAt > 0 ? slot.startedAt : createdAt;
        SiteResult result = new SiteResult(slot.site, envelope, System.currentTimeMillis() - started);
        results.add(result);
        try {
            listener.onResult(result);
        } catch (RuntimeException e) {
            logger.warn("Listener failed on {} result: {}", slot.site.getKey(), e.getMessage());
        }

        if (remaining.decrementAndGet() == 0) {
            finish();
        }
        return true;
    }

    /**
     * Runs once the query has no sites to wait for.
     */
    void finishIfEmpty() {
        if (slots.isEmpty()) finish();
    }

    private void finish() {
        Future<?> d = deadline;
        if (d != null) d.cancel(false);
        summary = summarize();
        try {
            listener.onComplete(summary);
        } catch (RuntimeException e) {
            logger.warn("Listener failed on completion of {}: {}", id, e.getMessage());
        } finally {
            finished.countDown();
            onFinish.accept(this);
        }
        logger.info("🏁 Query {} done: {}/{} ok, {} failed, {} timed out, {} cancelled in {}ms", id,
                summary.succeeded(), summary.sites(), summary.failed(), summary.timedOut(),
                summary.cancelled(), summary.wallTimeMs());
    }

    private AggregateSummary summarize() {
        int ok = 0, failed = 0, timedOut = 0, cancelledCount = 0, items = 0;
        synchronized (results) {
            for (SiteResult r : results) {
                switch (r.status()) {
                    case OK -> {
                        ok++;
                        items += r.envelope().getItems().size();
                    }
                    case FAILED -> failed++;
                    case TIMED_OUT -> timedOut++;
                    case CANCELLED -> cancelledCount++;
                }
            }
        }
        return new AggregateSummary(id, slots.size(), ok, failed, timedOut, cancelledCount, items,
                System.currentTimeMillis() - createdAt);
    }

    /**
     * Marks every unfinished site with the given status and interrupts its worker.
     */
    void abortPending(EnvelopeStatus status, String reason) {
        for (Slot slot : slots.values()) {
            ContentEnvelope envelope = status == EnvelopeStatus.CANCELLED
                    ? ContentEnvelope.cancelled()
                    : ContentEnvelope.timedOut(reason);
            if (complete(slot, envelope)) {
                Future<?> f = slot.future;
                if (f != null) f.cancel(true);
            }
        }
    }

    /**
     * Cancels all in-flight calls. Cancelled calls never write the cache.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            logger.info("🛑 Cancelling query {}", id);
            abortPending(EnvelopeStatus.CANCELLED, "cancelled");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isDone() {
        return finished.getCount() == 0;
    }

    /**
     * Blocks until every site has completed and returns all results in completion order.
     */
    public List<SiteResult> await() throws InterruptedException {
        finished.await();
        return getResults();
    }

    /**
     * @return the results so far if the query is still running when the wait ends
     */
    public List<SiteResult> await(long timeout, TimeUnit unit) throws InterruptedException {
        finished.await(timeout, unit);
        return getResults();
    }

    public List<SiteResult> getResults() {
        synchronized (results) {
            return new ArrayList<>(results);
        }
    }

    /**
     * Null until the query has finished.
     */
    public AggregateSummary getSummary() {
        return summary;
    }

    public int size() {
        return slots.size();
    }
}
