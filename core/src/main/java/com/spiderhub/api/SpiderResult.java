package com.spiderhub.api;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.spiderhub.common.model.Category;
import com.spiderhub.common.model.ContentItem;

import java.util.List;
import java.util.Map;

/**
 * Builds the JSON text spiders return: {@code class}, {@code list}, paging fields,
 * and for play results {@code parse}/{@code url}/{@code header}.
 */
public final class SpiderResult {
    private static final Gson gson = new Gson();

    private final JsonObject json = new JsonObject();

    private SpiderResult() {
    }

    public static SpiderResult create() {
        return new SpiderResult();
    }

    public static String error(String message) {
        JsonObject json = new JsonObject();
        json.addProperty("error", message);
        json.add("list", new JsonArray());
        json.add("class", new JsonArray());
        return json.toString();
    }

    public SpiderResult categories(List<Category> categories) {
        json.add("class", gson.toJsonTree(categories));
        return this;
    }

    public SpiderResult items(List<ContentItem> items) {
        json.add("list", gson.toJsonTree(items));
        return this;
    }

    public SpiderResult filters(JsonObject filters) {
        json.add("filters", filters);
        return this;
    }

    public SpiderResult page(int page, int pageCount, int limit, int total) {
        json.addProperty("page", page);
        json.addProperty("pagecount", pageCount);
        json.addProperty("limit", limit);
        json.addProperty("total", total);
        return this;
    }

    public SpiderResult play(String url, boolean parse, Map<String, String> headers) {
        json.addProperty("parse", parse ? 1 : 0);
        json.addProperty("url", url);
        if (headers != null && !headers.isEmpty()) {
            json.add("header", gson.toJsonTree(headers));
        }
        return this;
    }

    public SpiderResult flag(String flag) {
        json.addProperty("flag", flag);
        return this;
    }

    public String string() {
        return json.toString();
    }

    @Override
    public String toString() {
        return string();
    }
}
