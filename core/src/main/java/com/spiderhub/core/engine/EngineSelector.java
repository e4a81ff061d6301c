package com.spiderhub.core.engine;

import com.spiderhub.api.Invoker;
import com.spiderhub.common.error.BackendInitException;
import com.spiderhub.common.error.PermanentUpstreamException;
import com.spiderhub.common.error.SpiderException;
import com.spiderhub.common.error.TransientNetworkException;
import com.spiderhub.common.model.ContentEnvelope;
import com.spiderhub.common.model.Operation;
import com.spiderhub.common.model.OperationType;
import com.spiderhub.common.model.PlayDescriptor;
import com.spiderhub.common.model.Site;
import com.spiderhub.common.model.SiteKind;
import com.spiderhub.core.hook.HookManager;
import com.spiderhub.core.hook.HookPlayerUrl;
import com.spiderhub.core.net.SiteHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * Routes each operation to the backend that matches the site's kind.
 * <p>
 * Backends are brought up lazily, once per site. When the preferred backend fails to
 * start, the site is served by the rule backend with default rules until the cool-down
 * has passed, after which the preferred backend is tried again.
 */
public class EngineSelector {
    private static final Logger logger = LoggerFactory.getLogger(EngineSelector.class);

    private final ScriptBackend scriptBackend;
    private final ModuleBackend moduleBackend;
    private final RuleBackend ruleBackend;
    private final HookManager hooks;
    private final Function<Site, SiteHttpClient> httpFactory;
    private final EngineStats stats;
    private final EnvelopeNormalizer normalizer = new EnvelopeNormalizer();
    private final LongSupplier clock;
    private final long retryCooldownMs;

    private final Map<String, BackendSlot> slots = new ConcurrentHashMap<>();

    private static class BackendSlot {
        final ReentrantLock lock = new ReentrantLock();
        volatile Invoker invoker;
        volatile BackendType activeType;
        volatile Invoker fallback;
        volatile long failedAt;
        volatile String failure;
    }

    public EngineSelector(ScriptBackend scriptBackend, ModuleBackend moduleBackend, RuleBackend ruleBackend,
                          HookManager hooks, Function<Site, SiteHttpClient> httpFactory, EngineStats stats,
                          LongSupplier clock, long retryCooldownMs) {
        this.scriptBackend = scriptBackend;
        this.moduleBackend = moduleBackend;
        this.ruleBackend = ruleBackend;
        this.hooks = hooks;
        this.httpFactory = httpFactory;
        this.stats = stats;
        this.clock = clock;
        this.retryCooldownMs = retryCooldownMs;
    }

    public static BackendType preferredType(SiteKind kind) {
        return switch (kind) {
            case SCRIPT -> BackendType.SCRIPT;
            case MODULE -> BackendType.MODULE;
            case RULE_HTML, JSON_API -> BackendType.RULE;
        };
    }

    /**
     * Runs one operation against the site's backend and normalizes the result.
     *
     * @throws SpiderException      typed upstream or backend failure
     * @throws InterruptedException if the calling thread was interrupted
     */
    public ContentEnvelope execute(Site site, Operation operation) throws SpiderException, InterruptedException {
        BackendSlot slot = slots.computeIfAbsent(site.getKey(), k -> new BackendSlot());
        Invoker invoker = acquire(site, slot);
        BackendType type = slot.activeType;

        stats.recordCall(site.getKey());
        long start = System.currentTimeMillis();
        String raw;
        try {
            raw = invoker.call(operation.function(), operation.arguments());
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - start;
            if (e instanceof InterruptedException || Thread.currentThread().isInterrupted()) {
                stats.recordFailure(type, duration, "interrupted");
                Thread.currentThread().interrupt();
                throw new InterruptedException("Interrupted during " + operation.function() + " on " + site.getKey());
            }
            SpiderException error = classify(e);
            stats.recordFailure(type, duration, operation.function() + ": " + error.getMessage());
            throw error;
        }

        ContentEnvelope envelope;
        try {
            envelope = normalizer.normalize(operation, raw);
        } catch (SpiderException e) {
            stats.recordFailure(type, System.currentTimeMillis() - start, operation.function() + ": " + e.getMessage());
            throw e;
        }
        stats.recordSuccess(type, System.currentTimeMillis() - start);

        if (operation.type() == OperationType.PLAYER && envelope.getPlay() != null) {
            HookPlayerUrl processed = hooks.processPlayerUrl(site.getKey(), HookPlayerUrl.from(envelope.getPlay()));
            PlayDescriptor descriptor = processed.toDescriptor();
            envelope = envelope.withPlay(descriptor);
            logger.debug("▶️ Play URL for {}: {} ({})", site.getKey(), descriptor.url(), descriptor.mediaKind());
        }
        return envelope;
    }

    private Invoker acquire(Site site, BackendSlot slot) throws BackendInitException, InterruptedException {
        Invoker ready = slot.invoker;
        if (ready != null) return ready;

        slot.lock.lockInterruptibly();
        try {
            if (slot.invoker != null) return slot.invoker;

            BackendType preferred = preferredType(site.getKind());
            boolean coolingDown = slot.failedAt > 0 && clock.getAsLong() - slot.failedAt < retryCooldownMs;
            if (!coolingDown) {
                try {
                    Invoker invoker = backendFor(preferred).initialize(site, httpFactory.apply(site));
                    if (Thread.currentThread().isInterrupted()) {
                        invoker.destroy();
                        throw new InterruptedException("Interrupted while starting backend for " + site.getKey());
                    }
                    slot.activeType = preferred;
                    slot.invoker = invoker;
                    slot.failedAt = 0;
                    slot.failure = null;
                    destroyQuietly(slot.fallback);
                    slot.fallback = null;
                    logger.info("✅ {} backend ready for {}", preferred, site.getKey());
                    return invoker;
                } catch (BackendInitException e) {
                    slot.failedAt = clock.getAsLong();
                    slot.failure = e.getMessage();
                    stats.recordDemotion(site.getKey(), preferred, e.getMessage());
                    logger.warn("⚠️ {} backend failed for {}, falling back to default rules: {}",
                            preferred, site.getKey(), e.getMessage());
                }
            }

            if (slot.fallback == null) {
                slot.fallback = ruleBackend.initializeDefault(site, httpFactory.apply(site));
            }
            slot.activeType = BackendType.RULE;
            return slot.fallback;
        } finally {
            slot.lock.unlock();
        }
    }

    private Backend backendFor(BackendType type) {
        return switch (type) {
            case SCRIPT -> scriptBackend;
            case MODULE -> moduleBackend;
            case RULE -> ruleBackend;
        };
    }

    /**
     * Maps an arbitrary backend failure onto the typed hierarchy: I/O and anything that
     * reads like a network or timeout problem is transient, the rest is permanent.
     */
    static SpiderException classify(Exception e) {
        if (e instanceof SpiderException se) return se;
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        if (e instanceof IOException) {
            return new TransientNetworkException(message, e);
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("timeout") || lower.contains("timed out") || lower.contains("connection")
                || lower.contains("network")) {
            return new TransientNetworkException(message, e);
        }
        return new PermanentUpstreamException(message, e);
    }

    /**
     * The backend currently serving a site, or null if it has not been started yet.
     */
    public BackendType activeBackend(String siteKey) {
        BackendSlot slot = slots.get(siteKey);
        return slot == null ? null : slot.activeType;
    }

    /**
     * Tears down a site's backend so the next call starts it afresh.
     */
    public void reset(String siteKey) {
        BackendSlot slot = slots.remove(siteKey);
        if (slot != null) {
            destroyQuietly(slot.invoker);
            destroyQuietly(slot.fallback);
        }
    }

    public void shutdown() {
        List<String> keys = new ArrayList<>(slots.keySet());
        keys.forEach(this::reset);
        logger.info("🛑 Engine selector released {} backends", keys.size());
    }

    private static void destroyQuietly(Invoker invoker) {
        if (invoker == null) return;
        try {
            invoker.destroy();
        } catch (RuntimeException e) {
            logger.warn("Backend destroy failed: {}", e.getMessage());
        }
    }
}
