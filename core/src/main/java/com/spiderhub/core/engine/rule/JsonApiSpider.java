package com.spiderhub.core.engine.rule;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.spiderhub.api.Spider;
import com.spiderhub.api.SpiderContext;
import com.spiderhub.api.SpiderResult;
import com.spiderhub.common.util.UrlUtils;
import com.spiderhub.core.net.SiteHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Adapter for the standard VOD collection API ({@code /api.php/provide/vod}). The
 * upstream already answers in the common {@code vod_*} shape, so most calls only
 * build the query string and pass the body through.
 */
public class JsonApiSpider implements Spider {
    private static final Logger logger = LoggerFactory.getLogger(JsonApiSpider.class);
    private static final Set<String> MEDIA_EXTENSIONS = Set.of("m3u8", "mp4", "flv", "mkv", "ts");

    private SiteHttpClient http;
    private String api;
    private Map<String, String> headers = Map.of();

    @Override
    public void init(SpiderContext context, String ext) throws Exception {
        this.http = context.http();
        this.api = context.site().getApi().trim();
        if (!api.startsWith("http")) {
            throw new IllegalArgumentException("JSON api is not an http URL: " + api);
        }
        this.headers = context.site().getHeaders();
    }

    @Override
    public String homeContent(boolean filter) throws Exception {
        String body = http.get(query("ac=list"), headers);
        // some APIs only return classes on ac=list; the first listing page fills the home grid
        JsonObject home = parseObject(body);
        if (home != null && (!home.has("list") || home.getAsJsonArray("list").isEmpty())) {
            JsonObject videos = parseObject(http.get(query("ac=videolist&pg=1"), headers));
            if (videos != null && videos.has("list")) home.add("list", videos.get("list"));
            return home.toString();
        }
        return body;
    }

    @Override
    public String categoryContent(String tid, String pg, boolean filter, Map<String, String> extend) throws Exception {
        StringBuilder params = new StringBuilder("ac=videolist&t=").append(UrlUtils.encode(tid))
                .append("&pg=").append(UrlUtils.encode(pg));
        if (extend != null) {
            extend.forEach((k, v) -> params.append('&').append(UrlUtils.encode(k)).append('=').append(UrlUtils.encode(v)));
        }
        return http.get(query(params.toString()), headers);
    }

    @Override
    public String detailContent(List<String> ids) throws Exception {
        return http.get(query("ac=videolist&ids=" + UrlUtils.encode(String.join(",", ids))), headers);
    }

    @Override
    public String searchContent(String key, boolean quick) throws Exception {
        return http.get(query("ac=videolist&wd=" + UrlUtils.encode(key)), headers);
    }

    @Override
    public String playerContent(String flag, String id, List<String> vipFlags) throws Exception {
        boolean direct = MEDIA_EXTENSIONS.contains(UrlUtils.extension(id));
        boolean vip = vipFlags != null && vipFlags.contains(flag);
        logger.debug("Play {} via {} (direct={}, vip={})", id, flag, direct, vip);
        return SpiderResult.create().play(id, !direct || vip, Map.of()).flag(flag).string();
    }

    private String query(String params) {
        return api + (api.contains("?") ? "&" : "?") + params;
    }

    private static JsonObject parseObject(String body) {
        try {
            JsonElement el = JsonParser.parseString(body);
            return el.isJsonObject() ? el.getAsJsonObject() : null;
        } catch (RuntimeException e) {
            logger.debug("Body is not a JSON object: {}", e.getMessage());
            return null;
        }
    }

    public static boolean looksLikeApiUrl(String api) {
        String a = api == null ? "" : api.toLowerCase(Locale.ROOT);
        return a.contains("/api.php/provide/vod") || a.contains("/provide/vod") || a.endsWith(".json");
    }
}
