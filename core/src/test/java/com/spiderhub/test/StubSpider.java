package com.spiderhub.test;

import com.spiderhub.api.Spider;
import com.spiderhub.api.SpiderContext;
import com.spiderhub.api.SpiderResult;
import com.spiderhub.common.model.Category;
import com.spiderhub.common.model.ContentItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable in-process spider. Each content method answers from a handler that tests
 * can replace; every call is counted.
 */
public class StubSpider implements Spider {

    @FunctionalInterface
    public interface Handler {
        String handle(Object... args) throws Exception;
    }

    public final AtomicInteger calls = new AtomicInteger();
    public volatile String ext;
    public volatile boolean destroyed;

    public volatile Handler home = args -> SpiderResult.create()
            .categories(List.of(new Category("1", "Movies")))
            .items(items("home", 2))
            .string();
    public volatile Handler category = args -> SpiderResult.create()
            .items(items("cat" + args[0] + "-p" + args[1], 3))
            .page(Integer.parseInt((String) args[1]), 3, 3, 9)
            .string();
    public volatile Handler detail = args -> SpiderResult.create().items(items("detail", 1)).string();
    public volatile Handler search = args -> SpiderResult.create().items(items("hit-" + args[0], 15)).string();
    public volatile Handler player = args -> SpiderResult.create().play((String) args[1], false, Map.of()).string();

    public static List<ContentItem> items(String prefix, int count) {
        List<ContentItem> out = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            out.add(new ContentItem(prefix + "-" + i, prefix + " " + i, "", ""));
        }
        return out;
    }

    @Override
    public void init(SpiderContext context, String ext) {
        this.ext = ext;
    }

    @Override
    public String homeContent(boolean filter) throws Exception {
        calls.incrementAndGet();
        return home.handle(filter);
    }

    @Override
    public String categoryContent(String tid, String pg, boolean filter, Map<String, String> extend) throws Exception {
        calls.incrementAndGet();
        return category.handle(tid, pg, filter, extend);
    }

    @Override
    public String detailContent(List<String> ids) throws Exception {
        calls.incrementAndGet();
        return detail.handle(ids);
    }

    @Override
    public String searchContent(String key, boolean quick) throws Exception {
        calls.incrementAndGet();
        return search.handle(key, quick);
    }

    @Override
    public String playerContent(String flag, String id, List<String> vipFlags) throws Exception {
        calls.incrementAndGet();
        return player.handle(flag, id, vipFlags);
    }

    @Override
    public void destroy() {
        destroyed = true;
    }
}
