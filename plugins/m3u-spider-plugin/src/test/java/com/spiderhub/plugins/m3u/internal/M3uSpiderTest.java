package com.spiderhub.plugins.m3u.internal;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.spiderhub.api.SpiderContext;
import com.spiderhub.common.model.Site;
import com.spiderhub.common.model.SiteKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for M3uSpider with an inline playlist
 */
class M3uSpiderTest {

    private static final String PLAYLIST = """
            #EXTM3U
            #EXTINF:-1 tvg-id="1" group-title="News",World News
            https://live.example.com/news/index.m3u8
            #EXTINF:-1 tvg-id="2" group-title="News",Local News
            https://live.example.com/local/index.m3u8
            #EXTINF:-1 tvg-id="3" group-title="Sports",Football Live
            https://live.example.com/sports/index.m3u8
            """;

    private M3uSpider spider;

    @BeforeEach
    void setUp() throws Exception {
        Site site = Site.builder().key("m3u").name("Playlist").kind(SiteKind.MODULE).api("csp_M3u").ext(PLAYLIST).build();
        spider = new M3uSpider();
        spider.init(new SpiderContext(site, null), PLAYLIST);
    }

    @Test
    void testHomeListsGroupsAsCategories() throws Exception {
        JsonObject home = JsonParser.parseString(spider.homeContent(false)).getAsJsonObject();

        assertEquals(2, home.getAsJsonArray("class").size(), "One category per group");
        assertEquals("News", home.getAsJsonArray("class").get(0).getAsJsonObject().get("type_id").getAsString());
        assertEquals(3, home.getAsJsonArray("list").size());
    }

    @Test
    void testCategoryPaging() throws Exception {
        JsonObject page = JsonParser.parseString(spider.categoryContent("News", "1", false, Map.of())).getAsJsonObject();

        assertEquals(2, page.getAsJsonArray("list").size());
        assertEquals(1, page.get("pagecount").getAsInt());
        assertEquals(2, page.get("total").getAsInt());
    }

    @Test
    void testSearchIsCaseInsensitive() throws Exception {
        JsonObject result = JsonParser.parseString(spider.searchContent("NEWS", false)).getAsJsonObject();

        assertEquals(2, result.getAsJsonArray("list").size());
    }

    @Test
    void testDetailAndPlay() throws Exception {
        JsonObject detail = JsonParser.parseString(spider.detailContent(List.of("3"))).getAsJsonObject();
        JsonObject item = detail.getAsJsonArray("list").get(0).getAsJsonObject();
        assertEquals("Football Live$https://live.example.com/sports/index.m3u8", item.get("vod_play_url").getAsString());

        JsonObject play = JsonParser.parseString(spider.playerContent("M3U", "3", List.of())).getAsJsonObject();
        assertEquals(0, play.get("parse").getAsInt(), "Streams play directly");
        assertEquals("https://live.example.com/sports/index.m3u8", play.get("url").getAsString());
    }

    @Test
    void testUnknownChannelReportsError() throws Exception {
        JsonObject detail = JsonParser.parseString(spider.detailContent(List.of("999"))).getAsJsonObject();

        assertTrue(detail.has("error"));
    }

    @Test
    void testInitRequiresExt() {
        assertThrows(IllegalArgumentException.class, () -> new M3uSpider().init(null, " "));
    }
}
