package com.spiderhub.core.aggregate;

import com.spiderhub.api.SpiderResult;
import com.spiderhub.common.model.ContentEnvelope;
import com.spiderhub.common.model.EnvelopeStatus;
import com.spiderhub.common.model.Site;
import com.spiderhub.core.SpiderEngine;
import com.spiderhub.test.StubSpider;
import com.spiderhub.test.StubSpiderProvider;
import com.spiderhub.test.TestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for paging through a category
 */
class CategoryPagerTest extends TestBase {

    private SpiderEngine engine;
    private StubSpider spider;
    private Site site;

    @BeforeEach
    void createEngine() throws Exception {
        engine = newEngine();
        spider = new StubSpider();
        engine.registerSpider("csp_Pages", new StubSpiderProvider("Pages", spider));
        site = moduleSite("pages", "Pages");
    }

    @Test
    void testPagesUntilPageCount() {
        CategoryPager pager = engine.openCategory(site, "1", Map.of());

        assertTrue(pager.hasMore());
        assertEquals(1, pager.loadMore().getPage());
        assertEquals(2, pager.loadMore().getPage());
        ContentEnvelope last = pager.loadMore();

        assertEquals(3, last.getPage());
        assertEquals(3, pager.getPageCount());
        assertFalse(pager.hasMore());
        assertTrue(pager.loadMore().getItems().isEmpty(), "Past the end only empty pages come back");
        assertEquals(3, spider.calls.get());
    }

    @Test
    void testFailedPageDoesNotAdvance() {
        AtomicInteger attempts = new AtomicInteger();
        spider.category = args -> {
            if (attempts.incrementAndGet() == 2) return SpiderResult.error("page broken");
            return SpiderResult.create().items(StubSpider.items("p" + args[1], 2)).page(Integer.parseInt((String) args[1]), 5, 2, 10).string();
        };
        CategoryPager pager = engine.openCategory(site, "7", Map.of());

        pager.loadMore();
        ContentEnvelope failed = pager.loadMore();
        ContentEnvelope retried = pager.loadMore();

        assertEquals(EnvelopeStatus.FAILED, failed.getStatus());
        assertEquals(2, retried.getPage(), "The failed page is requested again");
        assertEquals(2, pager.getPage());
        assertEquals("7", pager.getTypeId());
    }

    @Test
    void testUnknownPageCountStopsOnEmptyPage() {
        spider.category = args -> {
            int page = Integer.parseInt((String) args[1]);
            return SpiderResult.create().items(page < 3 ? StubSpider.items("p" + page, 2) : List.of()).string();
        };
        CategoryPager pager = engine.openCategory(site, "1", Map.of());

        pager.loadMore();
        pager.loadMore();
        assertTrue(pager.hasMore());
        pager.loadMore();

        assertFalse(pager.hasMore());
        assertEquals(3, pager.getPage());
    }

    @Test
    void testReset() {
        CategoryPager pager = engine.openCategory(site, "1", Map.of());
        pager.loadMore();
        pager.loadMore();

        pager.reset();

        assertEquals(0, pager.getPage());
        assertTrue(pager.hasMore());
        assertEquals(1, pager.loadMore().getPage());
        assertEquals(2, spider.calls.get(), "Page 1 comes from the cache the second time");
    }
}
