package com.spiderhub.core.engine.rule;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.spiderhub.common.error.ConfigException;
import com.spiderhub.common.model.Category;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Extraction rules of an HTML site, read from the site's ext JSON.
 * <p>
 * URL templates take {@code {tid}}, {@code {pg}}, {@code {wd}} and {@code {id}}
 * placeholders plus any category filter key. Field rules are {@code selector@attr}
 * where attr is {@code text}, {@code html}, {@code ownText} or an attribute name.
 */
public class RuleConfig {
    private static final Gson gson = new Gson();

    // --- URLs ---
    public String baseUrl = "";
    public String homeUrl = "";
    public String categoryUrl = "";
    public String searchUrl = "";
    public String detailUrl = "";
    public String playUrl = "";
    public Map<String, String> headers = new HashMap<>();

    // --- Categories ---
    public List<Category> categories = new ArrayList<>();
    public String categoryItem = "";
    public String categoryName = "a@text";
    public String categoryId = "a@href";
    public String categoryIdPattern = "";

    // --- Listings ---
    public String listItem = "";
    public String searchItem = "";
    public String itemId = "a@href";
    public String itemIdPattern = "";
    public String itemName = "a@title";
    public String itemPic = "img@data-original";
    public String itemRemarks = "";
    public String pageCount = "";
    public String pageCountPattern = "(\\d+)";

    // --- Detail ---
    public String detailName = "h1@text";
    public String detailPic = "";
    public String detailContent = "";
    public String detailYear = "";
    public String detailArea = "";
    public String detailActor = "";
    public String detailDirector = "";
    public String playFromItem = "";
    public String playListItem = "";
    public String playEpisode = "a";

    // --- Play ---
    public boolean playParse = true;
    public String playMediaPattern = "";

    /**
     * Rules for a site's ext. Blank ext means defaults against {@code api}.
     */
    public static RuleConfig parse(String ext, String api) throws ConfigException {
        RuleConfig config;
        if (ext == null || ext.isBlank() || !ext.trim().startsWith("{")) {
            config = defaults(api);
        } else {
            try {
                config = gson.fromJson(ext, RuleConfig.class);
            } catch (JsonParseException e) {
                throw new ConfigException("Invalid rule JSON: " + e.getMessage(), e);
            }
            if (config == null) config = defaults(api);
        }

        if (config.baseUrl == null || config.baseUrl.isBlank()) {
            config.baseUrl = api;
        }
        config.baseUrl = config.baseUrl == null ? "" : config.baseUrl.replaceAll("/+$", "");
        if (!config.baseUrl.startsWith("http")) {
            throw new ConfigException("Rule site has no http base URL: " + config.baseUrl);
        }
        if (config.homeUrl == null || config.homeUrl.isBlank()) config.homeUrl = "/";
        if (config.searchItem == null || config.searchItem.isBlank()) config.searchItem = config.listItem;
        if (config.headers == null) config.headers = new HashMap<>();
        if (config.categories == null) config.categories = new ArrayList<>();
        return config;
    }

    /**
     * Best-effort rules for the common CMS page layouts.
     */
    public static RuleConfig defaults(String baseUrl) {
        RuleConfig c = new RuleConfig();
        c.baseUrl = baseUrl == null ? "" : baseUrl.replaceAll("/+$", "");
        c.homeUrl = "/";
        c.categoryUrl = "/vodshow/{tid}--------{pg}---.html";
        c.searchUrl = "/vodsearch/{wd}----------{pg}---.html";
        c.detailUrl = "/voddetail/{id}.html";
        c.categoryItem = ".navbar-items li a, .nav-menu-items li a, .stui-header__menu li a, .myui-header__menu li a";
        c.categoryName = "@text";
        c.categoryId = "@href";
        c.categoryIdPattern = "/(?:vodtype|type|vodshow)/(\\w+)";
        c.listItem = ".module-item, .stui-vodlist__box, .myui-vodlist__box, .vodlist_item, .module-search-item";
        c.searchItem = c.listItem;
        c.itemId = "a@href";
        c.itemIdPattern = "/(?:voddetail|detail|vod)/(\\w+)";
        c.itemName = "a@title";
        c.itemPic = "img@data-original";
        c.itemRemarks = ".module-item-note, .pic-text, .text-right@text";
        c.pageCount = ".page-link:last-child@href";
        c.detailName = "h1@text";
        c.detailPic = ".module-item-pic img@data-original";
        c.detailContent = ".module-info-introduction-content, .detail-content, .stui-content__desc@text";
        c.playFromItem = ".module-tab-item span, .stui-pannel__head .title, .nav-tabs li a";
        c.playListItem = ".module-play-list, .stui-content__playlist, .myui-content__list";
        c.playEpisode = "a";
        c.playParse = true;
        return c;
    }
}
