package com.spiderhub.core.engine.rule;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.spiderhub.api.SpiderContext;
import com.spiderhub.common.model.Site;
import com.spiderhub.core.hook.HookManager;
import com.spiderhub.core.net.SiteHttpClient;
import com.spiderhub.test.TestBase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the VOD collection API adapter
 */
class JsonApiSpiderTest extends TestBase {
    private static final String API = "http://api.test/api.php/provide/vod";

    private HookManager hooks;
    private JsonApiSpider spider;

    @BeforeEach
    void createSpider() throws Exception {
        hooks = new HookManager(testConfig());
        Site site = jsonSite("api", "api.test");
        spider = new JsonApiSpider();
        spider.init(new SpiderContext(site, new SiteHttpClient(site, transport, hooks)), "");
    }

    @AfterEach
    void stopHooks() {
        hooks.shutdown();
    }

    @Test
    void testHomeUsesClassListing() throws Exception {
        transport.respond(API + "?ac=list", fixture("json-list.json"));

        String home = spider.homeContent(false);

        assertEquals(1, transport.totalRequests(), "A listing with items needs no second request");
        assertTrue(home.contains("Night Train"));
    }

    @Test
    void testHomeFillsItemsFromFirstVideoPage() throws Exception {
        transport.respond(API + "?ac=list", "{\"class\":[{\"type_id\":1,\"type_name\":\"Movies\"}],\"list\":[]}");
        transport.respond(API + "?ac=videolist&pg=1", fixture("json-list.json"));

        JsonObject home = JsonParser.parseString(spider.homeContent(false)).getAsJsonObject();

        assertEquals(1, home.getAsJsonArray("class").size());
        assertEquals(2, home.getAsJsonArray("list").size());
    }

    @Test
    void testQueryStrings() throws Exception {
        transport.respond(API, "{\"list\":[]}");

        spider.categoryContent("2", "3", false, Map.of("year", "2021"));
        assertEquals(API + "?ac=videolist&t=2&pg=3&year=2021", transport.lastRequest().getUrl());

        spider.detailContent(List.of("11", "12"));
        assertEquals(API + "?ac=videolist&ids=11%2C12", transport.lastRequest().getUrl());

        spider.searchContent("blue harbor", false);
        assertEquals(API + "?ac=videolist&wd=blue+harbor", transport.lastRequest().getUrl());
    }

    @Test
    void testPlayerParseFlag() throws Exception {
        JsonObject direct = JsonParser.parseString(
                spider.playerContent("lineA", "https://cdn.example.com/1.m3u8", List.of())).getAsJsonObject();
        JsonObject page = JsonParser.parseString(
                spider.playerContent("lineA", "https://v.example.com/play/1", List.of())).getAsJsonObject();
        JsonObject vip = JsonParser.parseString(
                spider.playerContent("qq", "https://cdn.example.com/1.mp4", List.of("qq"))).getAsJsonObject();

        assertEquals(0, direct.get("parse").getAsInt());
        assertEquals(1, page.get("parse").getAsInt());
        assertEquals(1, vip.get("parse").getAsInt(), "VIP flags always go through a parser");
    }

    @Test
    void testNonHttpApiIsRejected() {
        Site site = Site.builder().key("bad").name("bad").api("ftp://x").type(1).build();
        JsonApiSpider bad = new JsonApiSpider();

        assertThrows(IllegalArgumentException.class,
                () -> bad.init(new SpiderContext(site, new SiteHttpClient(site, transport, hooks)), ""));
    }

    @Test
    void testApiUrlDetection() {
        assertTrue(JsonApiSpider.looksLikeApiUrl(API));
        assertTrue(JsonApiSpider.looksLikeApiUrl("https://x/list.json"));
        assertFalse(JsonApiSpider.looksLikeApiUrl("https://x/index.html"));
    }
}
