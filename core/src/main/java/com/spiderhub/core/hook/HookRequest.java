package com.spiderhub.core.hook;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outbound HTTP request as seen by request hooks.
 * Header names are case-insensitive.
 */
public class HookRequest implements HookValue<HookRequest> {
    private String url;
    private String method;
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private String body;
    private long timeoutMs;
    private final Map<String, String> attributes = new LinkedHashMap<>();

    public HookRequest(String url) {
        this(url, "GET");
    }

    public HookRequest(String url, String method) {
        this.url = url;
        this.method = method;
    }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getMethod() { return method; }
    public void setMethod(String method) { this.method = method; }

    public Map<String, String> getHeaders() { return headers; }

    public String getHeader(String name) { return headers.get(name); }

    public HookRequest header(String name, String value) {
        headers.put(name, value);
        return this;
    }

    public boolean hasHeader(String name) {
        String v = headers.get(name);
        return v != null && !v.isEmpty();
    }

    public String getBody() { return body; }
    public void setBody(String body) { this.body = body; }

    public long getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

    public Map<String, String> getAttributes() { return attributes; }

    @Override
    public HookRequest copy() {
        HookRequest c = new HookRequest(url, method);
        c.headers.putAll(headers);
        c.body = body;
        c.timeoutMs = timeoutMs;
        c.attributes.putAll(attributes);
        return c;
    }

    @Override
    public String toString() {
        return method + " " + url;
    }
}
