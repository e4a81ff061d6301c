package com.spiderhub.plugins.m3u.internal;

import com.spiderhub.api.Spider;
import com.spiderhub.api.SpiderContext;
import com.spiderhub.api.SpiderResult;
import com.spiderhub.common.model.Category;
import com.spiderhub.common.model.ContentItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Live/VOD playlist as a site: playlist groups are categories, channels are items and
 * every channel plays its stream URL directly.
 * <p>
 * The site's ext is either the playlist URL or the playlist text itself.
 */
public class M3uSpider implements Spider {
    private static final Logger logger = LoggerFactory.getLogger(M3uSpider.class);
    static final int PAGE_SIZE = 50;
    static final int HOME_SIZE = 20;

    private final M3uParser parser = new M3uParser();
    private SpiderContext context;
    private String source;
    private volatile List<M3uChannel> channels;

    @Override
    public void init(SpiderContext context, String ext) {
        this.context = context;
        this.source = ext == null ? "" : ext.trim();
        if (source.isEmpty()) {
            throw new IllegalArgumentException("M3U site needs a playlist URL or playlist text as ext");
        }
        if (source.startsWith("#EXTM3U")) {
            channels = parser.parse(source);
        }
    }

    private List<M3uChannel> channels() throws Exception {
        List<M3uChannel> loaded = channels;
        if (loaded == null) {
            synchronized (this) {
                if (channels == null) {
                    channels = parser.parse(context.http().get(source));
                    logger.info("📺 Playlist loaded: {} channels from {}", channels.size(), source);
                }
                loaded = channels;
            }
        }
        return loaded;
    }

    // ─── CONTENT ───

    @Override
    public String homeContent(boolean filter) throws Exception {
        List<M3uChannel> all = channels();
        Set<String> groups = new LinkedHashSet<>();
        all.forEach(c -> groups.add(c.group()));

        List<Category> categories = new ArrayList<>();
        groups.forEach(g -> categories.add(new Category(g, g)));

        return SpiderResult.create()
                .categories(categories)
                .items(toItems(all.subList(0, Math.min(HOME_SIZE, all.size()))))
                .string();
    }

    @Override
    public String categoryContent(String tid, String pg, boolean filter, Map<String, String> extend) throws Exception {
        List<M3uChannel> inGroup = channels().stream().filter(c -> c.group().equals(tid)).toList();
        int page = pg != null && pg.matches("\\d{1,6}") ? Math.max(1, Integer.parseInt(pg)) : 1;
        int pageCount = Math.max(1, (inGroup.size() + PAGE_SIZE - 1) / PAGE_SIZE);
        int from = Math.min(inGroup.size(), (page - 1) * PAGE_SIZE);
        int to = Math.min(inGroup.size(), from + PAGE_SIZE);

        return SpiderResult.create()
                .items(toItems(inGroup.subList(from, to)))
                .page(page, pageCount, PAGE_SIZE, inGroup.size())
                .string();
    }

    @Override
    public String detailContent(List<String> ids) throws Exception {
        List<ContentItem> items = new ArrayList<>();
        for (String id : ids) {
            Optional<M3uChannel> channel = find(id);
            if (channel.isEmpty()) continue;
            M3uChannel c = channel.get();
            ContentItem item = toItem(c);
            item.setTypeName(c.group());
            item.setPlayFrom("M3U");
            item.setPlayUrl(c.name().replace("$", " ").replace("#", " ") + "$" + c.url());
            items.add(item);
        }
        if (items.isEmpty()) {
            return SpiderResult.error("Channel not found: " + String.join(",", ids));
        }
        return SpiderResult.create().items(items).string();
    }

    @Override
    public String searchContent(String key, boolean quick) throws Exception {
        String needle = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
        List<M3uChannel> hits = channels().stream()
                .filter(c -> !needle.isEmpty() && c.name().toLowerCase(Locale.ROOT).contains(needle))
                .toList();
        return SpiderResult.create().items(toItems(hits)).string();
    }

    @Override
    public String playerContent(String flag, String id, List<String> vipFlags) throws Exception {
        String url = id.contains("://") ? id : find(id).map(M3uChannel::url).orElse("");
        if (url.isEmpty()) {
            return SpiderResult.error("Channel not found: " + id);
        }
        return SpiderResult.create().play(url, false, Map.of()).flag(flag).string();
    }

    private Optional<M3uChannel> find(String id) throws Exception {
        return channels().stream().filter(c -> c.id().equals(id)).findFirst();
    }

    private static List<ContentItem> toItems(List<M3uChannel> channels) {
        return channels.stream().map(M3uSpider::toItem).toList();
    }

    private static ContentItem toItem(M3uChannel c) {
        ContentItem item = new ContentItem();
        item.setId(c.id());
        item.setName(c.name());
        item.setPic(c.logo());
        item.setRemarks(c.group());
        item.setTypeId(c.group());
        return item;
    }
}
