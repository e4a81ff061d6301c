package com.spiderhub.core.hook;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Inbound HTTP response as seen by response hooks.
 */
public class HookResponse implements HookValue<HookResponse> {
    public static final String ATTR_SHOULD_RETRY = "should_retry";

    private final String url;
    private final int statusCode;
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private String body;
    private final Map<String, String> attributes = new LinkedHashMap<>();

    public HookResponse(String url, int statusCode, Map<String, String> headers, String body) {
        this.url = url;
        this.statusCode = statusCode;
        if (headers != null) this.headers.putAll(headers);
        this.body = body;
    }

    public String getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public Map<String, String> getHeaders() { return headers; }
    public String getHeader(String name) { return headers.get(name); }
    public String getBody() { return body; }
    public void setBody(String body) { this.body = body; }
    public Map<String, String> getAttributes() { return attributes; }

    public String getContentType() {
        return headers.get("Content-Type");
    }

    public void setContentType(String contentType) {
        headers.put("Content-Type", contentType);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 400;
    }

    public boolean isMarkedRetry() {
        return "true".equals(attributes.get(ATTR_SHOULD_RETRY));
    }

    @Override
    public HookResponse copy() {
        HookResponse c = new HookResponse(url, statusCode, headers, body);
        c.attributes.putAll(attributes);
        return c;
    }

    @Override
    public String toString() {
        return statusCode + " " + url;
    }
}
