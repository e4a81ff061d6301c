package com.spiderhub.core.optimizer;

import com.spiderhub.common.error.ErrorKind;
import com.spiderhub.common.error.SpiderException;
import com.spiderhub.common.model.ContentEnvelope;
import com.spiderhub.common.model.Operation;
import com.spiderhub.common.model.Site;
import com.spiderhub.core.cache.CacheKey;
import com.spiderhub.core.cache.ResultCache;
import com.spiderhub.core.config.EngineConfig;
import com.spiderhub.core.engine.EngineSelector;
import com.spiderhub.services.stats.StatisticsManager;
import com.spiderhub.services.stats.StatisticsManager.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Wraps every backend call: cache lookup with request collapsing, a per-site concurrency
 * permit, retries of transient failures with backoff, outcome bookkeeping and site health.
 * <p>
 * {@link #execute} never throws a {@link SpiderException}; failures come back as flagged
 * envelopes. Only interruption escapes, so cancelled calls can unwind.
 */
public class ReliabilityOptimizer {
    private static final Logger logger = LoggerFactory.getLogger(ReliabilityOptimizer.class);

    private final EngineConfig config;
    private final EngineSelector selector;
    private final ResultCache cache;
    private final StatisticsManager statistics;

    private final Map<String, Semaphore> permits = new ConcurrentHashMap<>();
    private final Map<String, SiteHealth> health = new ConcurrentHashMap<>();

    public ReliabilityOptimizer(EngineConfig config, EngineSelector selector, ResultCache cache,
                                StatisticsManager statistics) {
        this.config = config;
        this.selector = selector;
        this.cache = cache;
        this.statistics = statistics;
    }

    /**
     * Serves the operation from cache or runs it against the site.
     *
     * @throws InterruptedException if the call was cancelled
     */
    public ContentEnvelope execute(Site site, Operation operation) throws InterruptedException {
        CacheKey key = CacheKey.of(site, operation);
        long ttlMs = config.getTtlMs(operation.type());
        return cache.getOrLoad(key, ttlMs, () -> callSite(site, operation));
    }

    private ContentEnvelope callSite(Site site, Operation operation) throws InterruptedException {
        Semaphore permit = permits.computeIfAbsent(site.getKey(),
                k -> new Semaphore(Math.max(1, config.perSiteConcurrency), true));
        long waitMs = effectiveTimeoutMs(site, false);
        if (!permit.tryAcquire(waitMs, TimeUnit.MILLISECONDS)) {
            logger.warn("⏳ No free call slot for {} within {}ms", site.getKey(), waitMs);
            recordOutcome(site, operation, waitMs, Outcome.TIMEOUT, "no free call slot");
            return ContentEnvelope.timedOut("Site " + site.getKey() + " is busy");
        }

        try {
            return callWithRetry(site, operation);
        } finally {
            permit.release();
        }
    }

    private ContentEnvelope callWithRetry(Site site, Operation operation) throws InterruptedException {
        int attempt = 0;
        while (true) {
            long start = System.currentTimeMillis();
            try {
                ContentEnvelope envelope = selector.execute(site, operation);
                recordOutcome(site, operation, System.currentTimeMillis() - start, Outcome.SUCCESS, null);
                return envelope;
            } catch (SpiderException e) {
                recordOutcome(site, operation, System.currentTimeMillis() - start, Outcome.FAILURE, e.getMessage());
                if (e.isRetryable() && attempt < config.maxRetries) {
                    attempt++;
                    long delay = RetryBackoff.jitteredDelay(config.retryBaseDelayMs, config.retryMaxDelayMs, attempt);
                    logger.info("🔁 Retry {}/{} for {} {} in {}ms: {}", attempt, config.maxRetries,
                            site.getKey(), operation.type().key(), delay, e.getMessage());
                    RetryBackoff.sleep(delay);
                    continue;
                }
                if (e.isRetryable()) {
                    logger.warn("❌ {} {} failed after {} retries: {}", site.getKey(), operation.type().key(),
                            attempt, e.getMessage());
                } else {
                    logger.warn("❌ {} {} failed ({}): {}", site.getKey(), operation.type().key(),
                            e.getKind(), e.getMessage());
                }
                return ContentEnvelope.failed(e.getKind(), e.getMessage());
            } catch (RuntimeException e) {
                recordOutcome(site, operation, System.currentTimeMillis() - start, Outcome.FAILURE, e.toString());
                logger.error("Unexpected failure in {} {}", site.getKey(), operation.type().key(), e);
                return ContentEnvelope.failed(ErrorKind.INTERNAL, e.toString());
            }
        }
    }

    /**
     * Books a call that the caller gave up on after its timeout.
     */
    public void recordTimeout(Site site, Operation operation, long durationMs) {
        recordOutcome(site, operation, durationMs, Outcome.TIMEOUT, "timed out after " + durationMs + "ms");
    }

    private void recordOutcome(Site site, Operation operation, long durationMs, Outcome outcome, String error) {
        boolean slow = durationMs > config.slowCallThresholdMs;
        statistics.record(site.getKey(), operation.type(), durationMs, outcome, slow);
        if (error != null) {
            statistics.recordError(site.getKey(), operation.type().key() + ": " + error);
        }

        SiteHealth siteHealth = healthOf(site.getKey());
        HealthState before = siteHealth.getState();
        HealthState after = siteHealth.record(outcome == Outcome.SUCCESS);
        if (before != after) {
            logger.info("{} Site {} is now {} (error rate {})", after == HealthState.HEALTHY ? "💚" : "🩹",
                    site.getKey(), after, String.format("%.2f", siteHealth.errorRate()));
        }
    }

    /**
     * Per-call timeout: the site's own or the engine default, shortened for degraded
     * sites and for quick searches.
     */
    public long effectiveTimeoutMs(Site site, boolean quick) {
        double timeout = site.getTimeoutMs() > 0 ? site.getTimeoutMs() : config.defaultTimeoutMs;
        if (getHealth(site.getKey()) == HealthState.DEGRADED) {
            timeout *= config.degradedTimeoutFactor;
        }
        if (quick) {
            timeout *= config.quickTimeoutFactor;
        }
        return Math.max(1L, (long) timeout);
    }

    public HealthState getHealth(String siteKey) {
        SiteHealth h = health.get(siteKey);
        return h == null ? HealthState.HEALTHY : h.getState();
    }

    public double getErrorRate(String siteKey) {
        SiteHealth h = health.get(siteKey);
        return h == null ? 0.0 : h.errorRate();
    }

    public Map<String, HealthState> healthStates() {
        Map<String, HealthState> states = new TreeMap<>();
        health.forEach((k, v) -> states.put(k, v.getState()));
        return states;
    }

    public StatisticsManager getStatistics() {
        return statistics;
    }

    public void resetHealth(String siteKey) {
        SiteHealth h = health.get(siteKey);
        if (h != null) h.reset();
    }

    private SiteHealth healthOf(String siteKey) {
        return health.computeIfAbsent(siteKey,
                k -> new SiteHealth(config.healthWindow, config.healthMinSamples, config.errorRateThreshold));
    }
}
