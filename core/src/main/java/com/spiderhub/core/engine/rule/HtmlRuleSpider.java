package com.spiderhub.core.engine.rule;

import com.spiderhub.api.Spider;
import com.spiderhub.api.SpiderContext;
import com.spiderhub.api.SpiderResult;
import com.spiderhub.common.model.Category;
import com.spiderhub.common.model.ContentItem;
import com.spiderhub.common.util.UrlUtils;
import com.spiderhub.core.net.SiteHttpClient;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Config-driven HTML scraper. All extraction is described by a {@link RuleConfig};
 * pages are fetched through the site's hooked HTTP client and parsed with jsoup.
 */
public class HtmlRuleSpider implements Spider {
    private static final Logger logger = LoggerFactory.getLogger(HtmlRuleSpider.class);
    private static final Pattern LEFTOVER_PLACEHOLDER = Pattern.compile("\\{\\w+}");

    private RuleConfig rules;
    private SiteHttpClient http;
    private String siteKey;

    public HtmlRuleSpider() {
    }

    public HtmlRuleSpider(RuleConfig rules) {
        this.rules = rules;
    }

    @Override
    public void init(SpiderContext context, String ext) throws Exception {
        this.http = context.http();
        this.siteKey = context.site().getKey();
        if (rules == null) {
            rules = RuleConfig.parse(ext, context.site().getApi());
        }
        logger.debug("[{}] HTML rules ready, base {}", siteKey, rules.baseUrl);
    }

    public RuleConfig getRules() {
        return rules;
    }

    // ─── HOME ─────────────────────────────────────────────────────────────

    @Override
    public String homeContent(boolean filter) throws Exception {
        List<Category> categories = new ArrayList<>(rules.categories);
        List<ContentItem> items = List.of();

        boolean needPage = (categories.isEmpty() && !rules.categoryItem.isBlank()) || !rules.listItem.isBlank();
        if (needPage) {
            Document doc = fetch(url(rules.homeUrl, Map.of()));
            if (categories.isEmpty()) categories = parseCategories(doc);
            items = parseItems(doc, rules.listItem);
        }

        return SpiderResult.create().categories(categories).items(items).string();
    }

    private List<Category> parseCategories(Document doc) {
        List<Category> out = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (Element el : RuleExtractor.select(doc, rules.categoryItem)) {
            String name = RuleExtractor.extract(el, rules.categoryName);
            String rawId = RuleExtractor.extract(el, rules.categoryId);
            if (name.isEmpty() || rawId.isEmpty()) continue;
            String id = RuleExtractor.capture(rawId, rules.categoryIdPattern);
            // navigation links without a recognizable type id (home, about...) are not categories
            if (!rules.categoryIdPattern.isBlank() && id.equals(rawId)) continue;
            if (seen.add(id)) out.add(new Category(id, name));
        }
        return out;
    }

    // ─── CATEGORY / SEARCH ────────────────────────────────────────────────

    @Override
    public String categoryContent(String tid, String pg, boolean filter, Map<String, String> extend) throws Exception {
        int page = parsePage(pg);
        Map<String, String> vars = new LinkedHashMap<>();
        if (extend != null) vars.putAll(extend);
        vars.put("tid", tid);
        vars.put("pg", String.valueOf(page));

        Document doc = fetch(url(rules.categoryUrl, vars));
        List<ContentItem> items = parseItems(doc, rules.listItem);
        int pageCount = parsePageCount(doc, page, items.isEmpty());
        return SpiderResult.create().items(items).page(page, pageCount, items.size(), 0).string();
    }

    @Override
    public String searchContent(String key, boolean quick) throws Exception {
        if (rules.searchUrl.isBlank()) {
            return SpiderResult.create().items(List.of()).string();
        }
        Map<String, String> vars = Map.of("wd", UrlUtils.encode(key), "pg", "1");
        Document doc = fetch(url(rules.searchUrl, vars));
        List<ContentItem> items = parseItems(doc, rules.searchItem);
        return SpiderResult.create().items(items).string();
    }

    private List<ContentItem> parseItems(Document doc, String itemSelector) {
        List<ContentItem> results = new ArrayList<>();
        for (Element el : RuleExtractor.select(doc, itemSelector)) {
            try {
                String rawId = RuleExtractor.extract(el, rules.itemId);
                String id = RuleExtractor.capture(rawId, rules.itemIdPattern);
                String name = RuleExtractor.extract(el, rules.itemName);
                if (name.isEmpty()) name = RuleExtractor.extract(el, "a@text");
                if (id.isEmpty() || name.isEmpty()) continue;

                results.add(new ContentItem(id, name,
                        RuleExtractor.extractAbs(el, rules.itemPic, rules.baseUrl),
                        RuleExtractor.extract(el, rules.itemRemarks)));
            } catch (RuntimeException e) {
                logger.debug("[{}] Error parsing list item", siteKey, e);
            }
        }
        return results;
    }

    private int parsePageCount(Document doc, int page, boolean emptyPage) {
        if (!rules.pageCount.isBlank()) {
            String raw = RuleExtractor.extract(doc, rules.pageCount);
            Matcher m = Pattern.compile(rules.pageCountPattern).matcher(raw);
            int last = -1;
            while (m.find()) {
                String digits = m.group(m.groupCount() >= 1 ? 1 : 0);
                if (digits != null && digits.matches("\\d{1,9}")) last = Integer.parseInt(digits);
            }
            if (last >= page) return last;
        }
        // unknown: assume one more page while pages are not empty
        return emptyPage ? page : page + 1;
    }

    // ─── DETAIL ───────────────────────────────────────────────────────────

    @Override
    public String detailContent(List<String> ids) throws Exception {
        List<ContentItem> items = new ArrayList<>();
        for (String id : ids) {
            Document doc = fetch(detailUrl(id));
            ContentItem item = new ContentItem();
            item.setId(id);
            item.setName(RuleExtractor.extract(doc, rules.detailName));
            item.setPic(RuleExtractor.extractAbs(doc, rules.detailPic, rules.baseUrl));
            item.setContent(RuleExtractor.extract(doc, rules.detailContent));
            item.setYear(RuleExtractor.extract(doc, rules.detailYear));
            item.setArea(RuleExtractor.extract(doc, rules.detailArea));
            item.setActor(RuleExtractor.extract(doc, rules.detailActor));
            item.setDirector(RuleExtractor.extract(doc, rules.detailDirector));
            parsePlaylists(doc, item);
            items.add(item);
        }
        return SpiderResult.create().items(items).string();
    }

    private void parsePlaylists(Document doc, ContentItem item) {
        Elements tabs = RuleExtractor.select(doc, rules.playFromItem);
        Elements lists = RuleExtractor.select(doc, rules.playListItem);

        List<String> from = new ArrayList<>();
        List<String> urls = new ArrayList<>();
        for (int i = 0; i < lists.size(); i++) {
            List<String> episodes = new ArrayList<>();
            for (Element a : lists.get(i).select(rules.playEpisode)) {
                String name = a.text().trim();
                String href = a.attr("href").trim();
                if (href.isEmpty()) continue;
                // '$' and '#' are list separators in the play_url format
                episodes.add(name.replace("$", "").replace("#", "") + "$" + href);
            }
            if (episodes.isEmpty()) continue;
            from.add(i < tabs.size() ? tabs.get(i).text().trim() : "source" + (i + 1));
            urls.add(String.join("#", episodes));
        }
        item.setPlayFrom(String.join("$$$", from));
        item.setPlayUrl(String.join("$$$", urls));
    }

    // ─── PLAY ─────────────────────────────────────────────────────────────

    @Override
    public String playerContent(String flag, String id, List<String> vipFlags) throws Exception {
        String pageUrl = rules.playUrl.isBlank() ? absolute(id) : url(rules.playUrl, Map.of("id", id));

        if (!rules.playMediaPattern.isBlank()) {
            String html = http.get(pageUrl, rules.headers);
            Matcher m = Pattern.compile(rules.playMediaPattern).matcher(html);
            if (m.find()) {
                String media = (m.groupCount() >= 1 ? m.group(1) : m.group()).replace("\\/", "/");
                return SpiderResult.create().play(media, false, Map.of("Referer", pageUrl)).flag(flag).string();
            }
        }

        return SpiderResult.create().play(pageUrl, rules.playParse, rules.headers).flag(flag).string();
    }

    // ─── HELPERS ──────────────────────────────────────────────────────────

    private Document fetch(String url) throws Exception {
        String html = http.get(url, rules.headers);
        return Jsoup.parse(html, url);
    }

    private String detailUrl(String id) {
        if (id.startsWith("http") || id.startsWith("/") || rules.detailUrl.isBlank()) {
            return absolute(id);
        }
        return url(rules.detailUrl, Map.of("id", id));
    }

    private String absolute(String pathOrUrl) {
        if (pathOrUrl.startsWith("http://") || pathOrUrl.startsWith("https://")) return pathOrUrl;
        if (pathOrUrl.startsWith("//")) return "https:" + pathOrUrl;
        if (pathOrUrl.startsWith("/")) return rules.baseUrl + pathOrUrl;
        return rules.baseUrl + "/" + pathOrUrl;
    }

    String url(String template, Map<String, String> vars) {
        String result = template;
        for (Map.Entry<String, String> entry : vars.entrySet()) {
            result = result.replace("{" + entry.getKey() + "}", entry.getValue() == null ? "" : entry.getValue());
        }
        result = LEFTOVER_PLACEHOLDER.matcher(result).replaceAll("");
        return absolute(result);
    }

    private static int parsePage(String pg) {
        try {
            return Math.max(1, Integer.parseInt(pg.trim()));
        } catch (RuntimeException e) {
            return 1;
        }
    }
}
