package com.spiderhub.core.hook.builtin;

import com.spiderhub.core.hook.AbstractHook;
import com.spiderhub.core.hook.HookContext;
import com.spiderhub.core.hook.HookResponse;
import com.spiderhub.core.hook.HookResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.Locale;

/**
 * Makes sure textual responses declare a charset, taken from the page's
 * {@code <meta charset>} or {@code <meta http-equiv="Content-Type">} tag when it has
 * one, UTF-8 otherwise.
 */
public class EncodingHook extends AbstractHook<HookResponse> {
    public static final String NAME = "encoding";
    // meta tags live in the head
    private static final int SCAN_LIMIT = 4096;

    public EncodingHook() {
        super(NAME, 20);
    }

    @Override
    public HookResult<HookResponse> execute(HookResponse response, HookContext context) {
        String type = response.getContentType();
        if (type == null || !isTextual(type)) {
            return HookResult.skip("not textual");
        }
        if (type.toLowerCase(Locale.ROOT).contains("charset=")) {
            return HookResult.skip("charset present");
        }

        String charset = declaredCharset(response.getBody());
        response.setContentType(type + "; charset=" + (charset != null ? charset : "UTF-8"));
        return HookResult.success(response);
    }

    static String declaredCharset(String body) {
        if (body == null || body.indexOf('<') < 0) return null;
        Document doc = Jsoup.parse(body.length() > SCAN_LIMIT ? body.substring(0, SCAN_LIMIT) : body);

        for (Element meta : doc.select("meta[charset], meta[http-equiv][content]")) {
            String name;
            if (meta.hasAttr("charset")) {
                name = meta.attr("charset");
            } else if (meta.attr("http-equiv").trim().equalsIgnoreCase("content-type")) {
                name = charsetParam(meta.attr("content"));
            } else {
                continue;
            }
            String supported = supported(name);
            if (supported != null) return supported;
        }
        return null;
    }

    private static String charsetParam(String contentType) {
        for (String part : contentType.split(";")) {
            String p = part.trim();
            if (p.regionMatches(true, 0, "charset=", 0, "charset=".length())) {
                return p.substring("charset=".length());
            }
        }
        return null;
    }

    private static String supported(String name) {
        if (name == null) return null;
        String n = name.trim().replace("\"", "").replace("'", "");
        if (n.isEmpty()) return null;
        try {
            return Charset.isSupported(n) ? n.toUpperCase(Locale.ROOT) : null;
        } catch (IllegalCharsetNameException e) {
            return null;
        }
    }

    private static boolean isTextual(String type) {
        String t = type.toLowerCase(Locale.ROOT);
        return t.startsWith("text/") || t.contains("json") || t.contains("xml") || t.contains("mpegurl");
    }
}
