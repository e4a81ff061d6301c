package com.spiderhub.core;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.spiderhub.api.SpiderResult;
import com.spiderhub.common.error.ConfigException;
import com.spiderhub.common.error.ErrorKind;
import com.spiderhub.common.model.ContentEnvelope;
import com.spiderhub.common.model.EnvelopeStatus;
import com.spiderhub.common.model.OperationType;
import com.spiderhub.common.model.Site;
import com.spiderhub.common.model.SiteResult;
import com.spiderhub.core.cache.DiskCacheTier;
import com.spiderhub.core.config.EngineConfig;
import com.spiderhub.core.engine.BackendType;
import com.spiderhub.services.database.DatabaseService;
import com.spiderhub.test.StubSpider;
import com.spiderhub.test.StubSpiderProvider;
import com.spiderhub.test.TestBase;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for the engine facade
 */
class SpiderEngineTest extends TestBase {

    private StubSpider register(SpiderEngine engine, String name) {
        StubSpider spider = new StubSpider();
        engine.registerSpider(name, new StubSpiderProvider(name, spider));
        return spider;
    }

    @Test
    void testCachedCategoryNeedsNoUpstreamCall() throws Exception {
        SpiderEngine engine = newEngine();
        StubSpider spider = register(engine, "Demo");
        Site site = moduleSite("demo", "Demo");

        ContentEnvelope first = engine.resolveCategory(site, "1", 1, Map.of());
        long upstream = engine.getEngineStats().getUpstreamCalls("demo");
        ContentEnvelope second = engine.resolveCategory(site, "1", 1, Map.of());

        assertTrue(first.isOk());
        assertEquals(first.getItems(), second.getItems());
        assertEquals(upstream, engine.getEngineStats().getUpstreamCalls("demo"), "Second call is served from cache");
        assertEquals(1, spider.calls.get());
        assertEquals(1, engine.getCache().stats().memoryHits());
    }

    @Test
    void testDifferentPagesAreCachedSeparately() throws Exception {
        SpiderEngine engine = newEngine();
        StubSpider spider = register(engine, "Demo");
        Site site = moduleSite("demo", "Demo");

        engine.resolveCategory(site, "1", 1, Map.of());
        engine.resolveCategory(site, "1", 2, Map.of());
        engine.resolveCategory(site, "1", 1, Map.of("year", "2020"));

        assertEquals(3, spider.calls.get());
    }

    @Test
    void testJsonApiSiteThroughEngine() throws Exception {
        transport.respond("http://api.test/api.php/provide/vod?ac=videolist&wd=night", fixture("json-list.json"));
        SpiderEngine engine = newEngine();
        Site site = jsonSite("api", "api.test");

        ContentEnvelope result = engine.searchSite(site, "night", false);

        assertTrue(result.isOk(), result.toString());
        assertEquals(BackendType.RULE, engine.activeBackend(site));
        assertTrue(result.getItems().stream().anyMatch(i -> i.getName().contains("Night Train")));
        String ua = transport.lastRequest().getHeaders().get("User-Agent");
        assertNotNull(ua, "Request hooks ran on the outgoing call");
    }

    @Test
    void testResolveNeverThrows() throws Exception {
        SpiderEngine engine = newEngine();
        StubSpider spider = register(engine, "Demo");
        spider.detail = args -> {
            throw new IllegalStateException("parser exploded");
        };

        ContentEnvelope result = engine.resolveDetail(moduleSite("demo", "Demo"), List.of("1"));

        assertEquals(EnvelopeStatus.FAILED, result.getStatus());
        assertNotNull(result.getErrorKind());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testNullArgumentsNeverThrow() throws Exception {
        SpiderEngine engine = newEngine();
        StubSpider spider = register(engine, "Demo");
        Site site = moduleSite("demo", "Demo");
        Map<String, String> filters = new HashMap<>();
        filters.put(null, "2020");
        filters.put("area", null);

        ContentEnvelope detail = assertDoesNotThrow(() -> engine.resolveDetail(site, Arrays.asList("a", null)));
        ContentEnvelope category = assertDoesNotThrow(() -> engine.resolveCategory(site, null, 1, filters));
        ContentEnvelope play = assertDoesNotThrow(() ->
                engine.resolvePlay(site, null, "https://cdn.example.com/a.m3u8", Arrays.asList(null, "vip")));
        ContentEnvelope home = assertDoesNotThrow(() -> engine.resolveHome(null));
        ContentEnvelope search = assertDoesNotThrow(() -> engine.searchSite(site, null, false));

        assertTrue(detail.isOk(), detail.toString());
        assertTrue(category.isOk(), category.toString());
        assertTrue(play.isOk(), play.toString());
        assertTrue(search.isOk(), search.toString());
        assertEquals(ErrorKind.CONFIG, home.getErrorKind());

        AtomicReference<Object> seenIds = new AtomicReference<>();
        spider.detail = args -> {
            seenIds.set(args[0]);
            return SpiderResult.create().items(StubSpider.items("d", 1)).string();
        };
        engine.resolveDetail(site, Arrays.asList("x", null, "y"));
        assertEquals(List.of("x", "y"), (List<String>) seenIds.get(), "Null ids are dropped before the spider sees them");
    }

    @Test
    void testShutdownEngineReturnsCancelled() throws Exception {
        SpiderEngine engine = newEngine();
        register(engine, "Demo");
        Site site = moduleSite("demo", "Demo");
        engine.shutdown();

        assertEquals(EnvelopeStatus.CANCELLED, engine.resolveHome(site).getStatus());
        List<SiteResult> results = engine.searchAll(List.of(site), "x", false);
        assertEquals(1, results.size());
        assertEquals(EnvelopeStatus.CANCELLED, results.get(0).status());
    }

    @Test
    void testInvalidateDropsSiteEntries() throws Exception {
        SpiderEngine engine = newEngine();
        StubSpider demo = register(engine, "Demo");
        StubSpider other = register(engine, "Other");
        Site demoSite = moduleSite("demo", "Demo");
        Site otherSite = moduleSite("other", "Other");
        engine.resolveHome(demoSite);
        engine.resolveHome(otherSite);

        int dropped = engine.invalidate(demoSite);
        engine.resolveHome(demoSite);
        engine.resolveHome(otherSite);

        assertEquals(1, dropped);
        assertEquals(2, demo.calls.get());
        assertEquals(1, other.calls.get(), "Other sites keep their entries");
    }

    @Test
    void testPlayUrlGoesThroughPlayerHooks() throws Exception {
        SpiderEngine engine = newEngine();
        register(engine, "Demo");

        ContentEnvelope play = engine.resolvePlay(moduleSite("demo", "Demo"), "line", "https://cdn.example.com/v/1.m3u8", List.of());

        assertTrue(play.isOk());
        assertEquals("https://cdn.example.com/v/1.m3u8", play.getPlay().url());
        assertFalse(play.getPlay().needsParse());
    }

    @Test
    void testRegisterSpiderNameForms() throws Exception {
        SpiderEngine engine = newEngine();
        StubSpider prefixed = new StubSpider();
        StubSpider renamed = new StubSpider();
        engine.registerSpider("csp_Alpha", new StubSpiderProvider("Alpha", prefixed));
        engine.registerSpider("Beta", new StubSpiderProvider("SomethingElse", renamed));

        assertTrue(engine.resolveHome(moduleSite("a", "Alpha")).isOk());
        assertTrue(engine.resolveHome(moduleSite("b", "Beta")).isOk());
        assertEquals(1, prefixed.calls.get());
        assertEquals(1, renamed.calls.get());
        assertEquals(BackendType.MODULE, engine.activeBackend(moduleSite("b", "Beta")));
    }

    @Test
    void testStatsSnapshotSerializes() throws Exception {
        SpiderEngine engine = newEngine();
        register(engine, "Demo");
        Site site = moduleSite("demo", "Demo");
        engine.resolveHome(site);
        engine.searchAll(List.of(site), "x", false);

        EngineSnapshot snapshot = engine.stats();
        JsonObject json = JsonParser.parseString(snapshot.toJson()).getAsJsonObject();

        assertEquals(1, snapshot.aggregator().queries());
        assertTrue(snapshot.performance().containsKey("demo"));
        assertEquals(2, snapshot.performance().get("demo").calls().calls());
        assertTrue(json.has("cache"));
        assertTrue(json.has("hook"));
        assertTrue(json.getAsJsonObject("performance").has("demo"));
    }

    @Test
    void testClearStatsKeepsCachedResults() throws Exception {
        transport.respond("http://api.test/api.php/provide/vod?ac=videolist&wd=night", fixture("json-list.json"));
        SpiderEngine engine = newEngine();
        StubSpider spider = register(engine, "Demo");
        Site site = moduleSite("demo", "Demo");
        engine.resolveHome(site);
        engine.resolveHome(site);
        engine.searchSite(jsonSite("api", "api.test"), "night", false);
        engine.searchAll(List.of(site), "x", false);

        engine.clearStats();
        EngineSnapshot cleared = engine.stats();

        assertEquals(0, engine.getEngineStats().getUpstreamCalls("demo"));
        assertTrue(cleared.performance().isEmpty());
        assertEquals(0, cleared.cache().memoryHits());
        assertEquals(0, cleared.cache().misses());
        assertEquals(0, cleared.aggregator().queries());
        assertEquals(0, cleared.aggregator().siteCalls());
        assertTrue(cleared.hook().values().stream().allMatch(h -> h.success() == 0 && h.failure() == 0));

        assertTrue(engine.resolveHome(site).isOk());
        assertEquals(2, spider.calls.get(), "Cached home survives the reset");
        assertEquals(1, engine.stats().cache().memoryHits());
    }

    @Test
    void testSuggestionsReportDemotion() throws Exception {
        SpiderEngine engine = newEngine();
        Site missing = moduleSite("ghost", "DoesNotExist");

        engine.resolveHome(missing);
        List<String> suggestions = engine.suggestions();

        assertEquals(BackendType.RULE, engine.activeBackend(missing));
        assertTrue(suggestions.stream().anyMatch(s -> s.contains("ghost") && s.contains("default rules")),
                "Suggestions: " + suggestions);
    }

    @Test
    void testDiskCacheSurvivesEngineRestart() throws Exception {
        DatabaseService db = newDatabase();
        EngineConfig config = testConfig();
        config.diskCacheEnabled = true;
        Site site = moduleSite("demo", "Demo");

        SpiderEngine first = start(engineBuilder(config).database(db));
        StubSpider firstSpider = register(first, "Demo");
        assertTrue(first.resolveHome(site).isOk());
        first.shutdown();

        SpiderEngine second = start(engineBuilder(config).database(db));
        StubSpider secondSpider = register(second, "Demo");
        ContentEnvelope home = second.resolveHome(site);

        assertTrue(home.isOk());
        assertEquals(1, firstSpider.calls.get());
        assertEquals(0, secondSpider.calls.get(), "Home came from the disk tier");
        assertEquals(1, second.getCache().stats().diskHits());
    }

    @Test
    void testExpiredDiskRowsArePurgedInBackground() throws Exception {
        DatabaseService db = newDatabase();
        AtomicLong now = new AtomicLong(1_000_000L);
        EngineConfig config = testConfig();
        config.diskCacheEnabled = true;
        config.diskCachePurgeIntervalMs = 50;
        Site site = moduleSite("demo", "Demo");

        SpiderEngine engine = start(engineBuilder(config).database(db).clock(now::get));
        register(engine, "Demo");
        assertTrue(engine.resolveHome(site).isOk());

        DiskCacheTier rows = new DiskCacheTier(db, now::get, 100);
        assertEquals(1, rows.count());

        now.addAndGet(config.getTtlMs(OperationType.HOME) + 1);
        long waitUntil = System.currentTimeMillis() + 3000;
        while (rows.count() > 0 && System.currentTimeMillis() < waitUntil) {
            Thread.sleep(20);
        }
        assertEquals(0, rows.count(), "Expired row should be purged without a read touching it");
    }

    @Test
    void testBrokenSiteFailsOnlyItself() throws Exception {
        SpiderEngine engine = newEngine();
        register(engine, "Demo");
        Site broken = Site.builder().key("broken").name("broken").api("").build();
        Site good = moduleSite("demo", "Demo");

        ContentEnvelope direct = engine.resolveHome(broken);
        List<SiteResult> results = engine.searchAll(List.of(broken, good), "x", false);

        assertEquals(ErrorKind.CONFIG, direct.getErrorKind());
        assertEquals(2, results.size());
        SiteResult brokenResult = results.stream().filter(r -> r.site().getKey().equals("broken")).findFirst().orElseThrow();
        SiteResult goodResult = results.stream().filter(r -> r.site().getKey().equals("demo")).findFirst().orElseThrow();
        assertEquals(ErrorKind.CONFIG, brokenResult.envelope().getErrorKind());
        assertTrue(goodResult.isOk());
    }

    @Test
    void testInvalidConfigRejected() {
        EngineConfig config = testConfig();
        config.perSiteConcurrency = 0;

        assertThrows(ConfigException.class, () -> newEngine(config));
    }
}
