package com.spiderhub.core.hook.builtin;

import com.spiderhub.core.hook.AbstractHook;
import com.spiderhub.core.hook.HookContext;
import com.spiderhub.core.hook.HookResponse;
import com.spiderhub.core.hook.HookResult;

import java.util.Locale;

/**
 * Infers a Content-Type from the body when the upstream sent none
 * (or the useless {@code application/octet-stream}).
 */
public class ContentTypeHook extends AbstractHook<HookResponse> {
    public static final String NAME = "content-type";

    public ContentTypeHook() {
        super(NAME, 10);
    }

    @Override
    public HookResult<HookResponse> execute(HookResponse response, HookContext context) {
        String current = response.getContentType();
        if (current != null && !current.isBlank() && !current.toLowerCase(Locale.ROOT).startsWith("application/octet-stream")) {
            return HookResult.skip("content type present");
        }
        String body = response.getBody();
        if (body == null || body.isBlank()) {
            return HookResult.skip("empty body");
        }
        response.setContentType(detect(body));
        return HookResult.success(response);
    }

    static String detect(String body) {
        String head = body.stripLeading();
        if (head.startsWith("{") || head.startsWith("[")) return "application/json";
        if (head.startsWith("#EXTM3U")) return "application/vnd.apple.mpegurl";
        String lower = head.length() > 256 ? head.substring(0, 256).toLowerCase(Locale.ROOT) : head.toLowerCase(Locale.ROOT);
        if (lower.startsWith("<!doctype html") || lower.startsWith("<html") || lower.contains("<body")) return "text/html";
        if (lower.startsWith("<?xml")) return "application/xml";
        return "text/plain";
    }
}
