package com.spiderhub.core.engine;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonParseException;
import com.spiderhub.common.error.MalformedResponseException;
import com.spiderhub.common.error.PermanentUpstreamException;
import com.spiderhub.common.error.SpiderException;
import com.spiderhub.common.model.Category;
import com.spiderhub.common.model.ContentEnvelope;
import com.spiderhub.common.model.ContentItem;
import com.spiderhub.common.model.MediaKind;
import com.spiderhub.common.model.Operation;
import com.spiderhub.common.model.OperationType;
import com.spiderhub.common.model.PlayDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns the raw JSON text of a backend call into a {@link ContentEnvelope}.
 */
public class EnvelopeNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(EnvelopeNormalizer.class);
    private final Gson gson = new Gson();

    /**
     * @throws MalformedResponseException if the text is not a JSON object, or a play result has no URL
     * @throws PermanentUpstreamException if the backend reported an {@code error}
     */
    public ContentEnvelope normalize(Operation operation, String raw) throws SpiderException {
        if (raw == null || raw.isBlank()) {
            throw new MalformedResponseException("Empty " + operation.function() + " result");
        }

        JsonObject json;
        try {
            JsonElement parsed = JsonParser.parseString(raw);
            if (!parsed.isJsonObject()) {
                throw new MalformedResponseException(operation.function() + " did not return a JSON object");
            }
            json = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new MalformedResponseException("Unparsable " + operation.function() + " result: " + e.getMessage(), e);
        }

        String error = string(json, "error");
        if (!error.isEmpty()) {
            throw new PermanentUpstreamException(error);
        }

        ContentEnvelope.Builder b = ContentEnvelope.builder();
        JsonArray list = array(json, "list");
        if (list != null) {
            for (JsonElement el : list) {
                ContentItem item = toItem(el);
                if (item != null) b.item(item);
            }
        }
        JsonArray classes = array(json, "class");
        if (classes != null) {
            for (JsonElement el : classes) {
                if (!el.isJsonObject()) continue;
                String id = string(el.getAsJsonObject(), "type_id");
                String name = string(el.getAsJsonObject(), "type_name");
                if (!id.isEmpty()) b.category(new Category(id, name));
            }
        }
        if (json.has("filters") && json.get("filters").isJsonObject()) {
            b.filters(json.getAsJsonObject("filters"));
        }

        int page = integer(json, "page");
        if (page == 0 && operation instanceof Operation.Category category) page = category.page();
        b.page(page)
                .pageCount(integer(json, "pagecount"))
                .limit(integer(json, "limit"))
                .total(integer(json, "total"));

        if (operation.type() == OperationType.PLAYER) {
            b.play(toPlay(json, (Operation.Player) operation));
        }
        return b.build();
    }

    private PlayDescriptor toPlay(JsonObject json, Operation.Player operation) throws MalformedResponseException {
        String url = string(json, "url");
        String prefix = string(json, "playUrl");
        if (!prefix.isEmpty()) url = prefix + url;
        if (url.isEmpty()) {
            throw new MalformedResponseException("Play result without url for " + operation.id());
        }

        boolean parse = integer(json, "parse") == 1 || integer(json, "jx") == 1;
        String flag = string(json, "flag");
        return new PlayDescriptor(url, headers(json.get("header")), parse,
                flag.isEmpty() ? operation.flag() : flag, parse ? MediaKind.NEEDS_PARSE : MediaKind.UNKNOWN);
    }

    // header is either an object or a JSON string of one
    private Map<String, String> headers(JsonElement header) {
        Map<String, String> out = new LinkedHashMap<>();
        if (header == null || header.isJsonNull()) return out;
        JsonElement h = header;
        if (h.isJsonPrimitive()) {
            try {
                h = JsonParser.parseString(h.getAsString());
            } catch (JsonParseException e) {
                logger.debug("Ignoring unparsable play header: {}", header);
                return out;
            }
        }
        if (h.isJsonObject()) {
            for (Map.Entry<String, JsonElement> e : h.getAsJsonObject().entrySet()) {
                if (e.getValue().isJsonPrimitive()) out.put(e.getKey(), e.getValue().getAsString());
            }
        }
        return out;
    }

    private ContentItem toItem(JsonElement el) {
        if (!el.isJsonObject()) return null;
        try {
            ContentItem item = gson.fromJson(el, ContentItem.class);
            return item != null && item.getId() != null && !item.getId().isEmpty() ? item : null;
        } catch (JsonParseException e) {
            logger.debug("Dropping malformed item: {}", e.getMessage());
            return null;
        }
    }

    private static JsonArray array(JsonObject json, String key) {
        JsonElement el = json.get(key);
        return el != null && el.isJsonArray() ? el.getAsJsonArray() : null;
    }

    private static String string(JsonObject json, String key) {
        JsonElement el = json.get(key);
        if (el == null || el.isJsonNull() || !el.isJsonPrimitive()) return "";
        return el.getAsString();
    }

    private static int integer(JsonObject json, String key) {
        String s = string(json, key).trim();
        if (s.isEmpty()) return 0;
        try {
            return (int) Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
