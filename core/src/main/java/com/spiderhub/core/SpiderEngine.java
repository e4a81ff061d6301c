package com.spiderhub.core;

import com.spiderhub.api.ModuleLoader;
import com.spiderhub.api.ScriptRuntime;
import com.spiderhub.api.Spider;
import com.spiderhub.api.SpiderProvider;
import com.spiderhub.api.Transport;
import com.spiderhub.common.error.ConfigException;
import com.spiderhub.common.error.ErrorKind;
import com.spiderhub.common.model.ContentEnvelope;
import com.spiderhub.common.model.Operation;
import com.spiderhub.common.model.Site;
import com.spiderhub.common.model.SiteResult;
import com.spiderhub.core.aggregate.AggregateListener;
import com.spiderhub.core.aggregate.AggregateQuery;
import com.spiderhub.core.aggregate.CategoryPager;
import com.spiderhub.core.aggregate.ConcurrentAggregator;
import com.spiderhub.core.cache.CacheKey;
import com.spiderhub.core.cache.DiskCacheTier;
import com.spiderhub.core.cache.MemoryCacheTier;
import com.spiderhub.core.cache.ResultCache;
import com.spiderhub.core.config.ConfigValidator;
import com.spiderhub.core.config.EngineConfig;
import com.spiderhub.core.engine.BackendType;
import com.spiderhub.core.engine.EngineSelector;
import com.spiderhub.core.engine.EngineStats;
import com.spiderhub.core.engine.ModuleBackend;
import com.spiderhub.core.engine.RuleBackend;
import com.spiderhub.core.engine.ScriptBackend;
import com.spiderhub.core.hook.Hook;
import com.spiderhub.core.hook.HookManager;
import com.spiderhub.core.hook.HookPlayerUrl;
import com.spiderhub.core.hook.HookRequest;
import com.spiderhub.core.hook.HookResponse;
import com.spiderhub.core.net.JsoupTransport;
import com.spiderhub.core.net.SiteHttpClient;
import com.spiderhub.core.optimizer.OptimizationAdvisor;
import com.spiderhub.core.optimizer.ReliabilityOptimizer;
import com.spiderhub.core.plugin.JarModuleLoader;
import com.spiderhub.services.database.DatabaseService;
import com.spiderhub.services.stats.StatisticsManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Entry point of the spider engine: wires hooks, backends, cache, optimizer and
 * aggregator together and exposes the content operations.
 * <p>
 * The {@code resolve*} methods never throw; failures come back as envelopes whose
 * status and error kind say what went wrong.
 */
public class SpiderEngine {
    private static final Logger logger = LoggerFactory.getLogger(SpiderEngine.class);

    private final EngineConfig config;
    private final HookManager hooks;
    private final Transport transport;
    private final ModuleLoader moduleLoader;
    private final JarModuleLoader jarModules;
    private final EngineStats engineStats = new EngineStats();
    private final EngineSelector selector;
    private final ResultCache cache;
    private final DatabaseService database;
    private final boolean ownsDatabase;
    private final ReliabilityOptimizer optimizer;
    private final OptimizationAdvisor advisor;
    private final ConcurrentAggregator aggregator;
    private final ScheduledExecutorService purgeScheduler;
    private final AtomicBoolean running = new AtomicBoolean(true);

    private SpiderEngine(Builder b) {
        this.config = b.config;
        this.hooks = new HookManager(config);
        this.transport = b.transport != null ? b.transport : new JsoupTransport((int) config.defaultTimeoutMs);

        if (b.moduleLoader != null) {
            this.moduleLoader = b.moduleLoader;
            this.jarModules = b.moduleLoader instanceof JarModuleLoader j ? j : null;
        } else {
            this.jarModules = new JarModuleLoader(new File(config.moduleDir), transport, hooks);
            this.moduleLoader = jarModules;
        }

        this.selector = new EngineSelector(new ScriptBackend(b.scriptRuntime), new ModuleBackend(moduleLoader),
                new RuleBackend(), hooks, site -> new SiteHttpClient(site, transport, hooks), engineStats,
                b.clock, config.backendRetryCooldownMs);

        if (config.cacheEnabled && config.diskCacheEnabled) {
            this.ownsDatabase = b.database == null;
            this.database = b.database != null ? b.database : DatabaseService.file(config.diskCachePath);
        } else {
            this.ownsDatabase = false;
            this.database = null;
        }
        MemoryCacheTier memory = new MemoryCacheTier(config.memoryCacheMaxEntries, config.memoryCacheMaxBytes, b.clock);
        DiskCacheTier disk = database == null ? null : new DiskCacheTier(database, b.clock, config.diskCacheMaxEntries);
        this.cache = new ResultCache(memory, disk, b.clock, config.cacheEnabled);
        if (disk != null) {
            cache.purgeExpired();
        }
        this.purgeScheduler = disk != null && config.diskCachePurgeIntervalMs > 0
                ? schedulePurge(config.diskCachePurgeIntervalMs) : null;

        this.optimizer = new ReliabilityOptimizer(config, selector, cache, new StatisticsManager());
        this.advisor = new OptimizationAdvisor(config);
        this.aggregator = new ConcurrentAggregator(config, optimizer);

        logger.info("🕷️ Spider engine ready (cache {}, disk {})", config.cacheEnabled ? "on" : "off",
                database != null ? database.getUrl() : "off");
    }

    private ScheduledExecutorService schedulePurge(long intervalMs) {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Cache-Purge");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                cache.purgeExpired();
            } catch (RuntimeException e) {
                logger.warn("Scheduled cache purge failed: {}", e.getMessage());
            }
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        return scheduler;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ─── CONTENT ───

    public ContentEnvelope resolveHome(Site site) {
        return run(site, () -> new Operation.Home(site.isFilterable()));
    }

    public ContentEnvelope resolveCategory(Site site, String typeId, int page, Map<String, String> filters) {
        return run(site, () -> new Operation.Category(typeId, page, site.isFilterable(), filters));
    }

    public ContentEnvelope resolveDetail(Site site, List<String> ids) {
        return run(site, () -> new Operation.Detail(ids));
    }

    public ContentEnvelope resolvePlay(Site site, String flag, String id, List<String> vipFlags) {
        return run(site, () -> new Operation.Player(flag, id, vipFlags));
    }

    /**
     * Search on one site, with quick-mode truncation applied.
     */
    public ContentEnvelope searchSite(Site site, String keyword, boolean quick) {
        if (site != null && (!site.isSearchable() || (quick && !site.isQuickSearchable()))) {
            return ContentEnvelope.empty();
        }
        ContentEnvelope envelope = run(site, () -> new Operation.Search(keyword, quick));
        return quick ? envelope.truncated(config.quickResultLimit) : envelope;
    }

    /**
     * Pages through one category of one site.
     */
    public CategoryPager openCategory(Site site, String typeId, Map<String, String> filters) {
        return new CategoryPager(site, new Operation.Category(typeId, 1, site.isFilterable(), filters), this::run);
    }

    private ContentEnvelope run(Site site, Operation operation) {
        return run(site, () -> operation);
    }

    /**
     * The operation is built inside the guard, so bad arguments also come back as an envelope.
     */
    private ContentEnvelope run(Site site, Supplier<Operation> operation) {
        if (!running.get()) {
            return ContentEnvelope.cancelled();
        }
        if (site == null) {
            return ContentEnvelope.failed(ErrorKind.CONFIG, "No site given");
        }
        try {
            return aggregator.executeOne(site, operation.get());
        } catch (RuntimeException e) {
            logger.error("Unexpected failure resolving on {}", site.getKey(), e);
            return ContentEnvelope.failed(ErrorKind.INTERNAL, e.toString());
        }
    }

    // ─── AGGREGATE ───

    public AggregateQuery search(List<Site> sites, String keyword, boolean quick) {
        return search(sites, keyword, quick, AggregateListener.NONE);
    }

    public AggregateQuery search(List<Site> sites, String keyword, boolean quick, AggregateListener listener) {
        return aggregator.search(sites, keyword, quick, listener);
    }

    public AggregateQuery aggregateHome(List<Site> sites, AggregateListener listener) {
        return aggregator.aggregateHome(sites, listener);
    }

    /**
     * Blocking search over all sites.
     */
    public List<SiteResult> searchAll(List<Site> sites, String keyword, boolean quick) throws InterruptedException {
        return search(sites, keyword, quick).await();
    }

    // ─── REGISTRATION ───

    /**
     * Makes an in-process spider available to sites whose api is {@code csp_<name>} and
     * whose jar is empty.
     */
    public void registerSpider(String name, SpiderProvider provider) {
        if (jarModules == null) {
            throw new IllegalStateException("Custom module loader does not accept in-process spiders");
        }
        String bare = name.startsWith("csp_") ? name.substring(4) : name;
        if (bare.equalsIgnoreCase(provider.getName())) {
            jarModules.registerInternal(provider);
            return;
        }
        jarModules.registerInternal(new SpiderProvider() {
            @Override
            public String getName() {
                return bare;
            }

            @Override
            public String getVersion() {
                return provider.getVersion();
            }

            @Override
            public Spider create() {
                return provider.create();
            }
        });
    }

    public void registerRequestHook(Hook<HookRequest> hook) { hooks.registerRequestHook(hook); }
    public void registerResponseHook(Hook<HookResponse> hook) { hooks.registerResponseHook(hook); }
    public void registerPlayerHook(Hook<HookPlayerUrl> hook) { hooks.registerPlayerHook(hook); }

    // ─── MAINTENANCE ───

    /**
     * Drops every cached result of the site.
     */
    public int invalidate(Site site) {
        return cache.invalidate(CacheKey.sitePrefix(site.getKey()));
    }

    /**
     * Forgets the site's backend and health so it starts fresh on the next call.
     */
    public void resetSite(Site site) {
        selector.reset(site.getKey());
        optimizer.resetHealth(site.getKey());
    }

    public BackendType activeBackend(Site site) {
        return selector.activeBackend(site.getKey());
    }

    public List<String> suggestions() {
        return advisor.suggestions(optimizer, engineStats, cache.stats());
    }

    public EngineSnapshot stats() {
        StatisticsManager statistics = optimizer.getStatistics();
        Map<String, EngineSnapshot.SitePerformance> performance = new TreeMap<>();
        statistics.getAllSites().forEach((site, calls) -> performance.put(site,
                new EngineSnapshot.SitePerformance(calls, optimizer.getHealth(site), optimizer.getErrorRate(site),
                        statistics.getRecentErrors(site))));
        return new EngineSnapshot(engineStats.snapshot(), hooks.stats(), cache.stats(), aggregator.stats(), performance);
    }

    /**
     * Zeroes every statistics counter. Cached results and site health are kept.
     */
    public void clearStats() {
        engineStats.clear();
        optimizer.getStatistics().clear();
        hooks.clearStats();
        cache.resetStats();
        aggregator.resetStats();
        logger.info("🧹 Statistics cleared");
    }

    public EngineStats getEngineStats() { return engineStats; }
    public ResultCache getCache() { return cache; }
    public ReliabilityOptimizer getOptimizer() { return optimizer; }
    public HookManager getHooks() { return hooks; }
    public EngineConfig getConfig() { return config; }

    public void shutdown() {
        if (!running.getAndSet(false)) return;
        logger.info("🛑 Spider engine shutting down...");
        aggregator.shutdown();
        if (purgeScheduler != null) {
            purgeScheduler.shutdownNow();
        }
        selector.shutdown();
        try {
            moduleLoader.close();
        } catch (RuntimeException e) {
            logger.warn("Module loader close failed: {}", e.getMessage());
        }
        hooks.shutdown();
        if (ownsDatabase) {
            database.shutdown();
        }
        logger.info("✅ Spider engine stopped.");
    }

    public static class Builder {
        private EngineConfig config = new EngineConfig();
        private Transport transport;
        private ScriptRuntime scriptRuntime;
        private ModuleLoader moduleLoader;
        private DatabaseService database;
        private LongSupplier clock = System::currentTimeMillis;

        public Builder config(EngineConfig config) { this.config = config; return this; }
        public Builder transport(Transport transport) { this.transport = transport; return this; }
        public Builder scriptRuntime(ScriptRuntime scriptRuntime) { this.scriptRuntime = scriptRuntime; return this; }
        public Builder moduleLoader(ModuleLoader moduleLoader) { this.moduleLoader = moduleLoader; return this; }
        // Shared cache database; the engine leaves its lifecycle to the caller.
        public Builder database(DatabaseService database) { this.database = database; return this; }
        public Builder clock(LongSupplier clock) { this.clock = clock; return this; }

        /**
         * @throws ConfigException if the configuration has errors
         */
        public SpiderEngine build() throws ConfigException {
            new ConfigValidator().validateAndReport(config);
            return new SpiderEngine(this);
        }
    }
}
