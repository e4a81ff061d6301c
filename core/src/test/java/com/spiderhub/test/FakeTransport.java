package com.spiderhub.test;

import com.spiderhub.api.Transport;
import com.spiderhub.core.hook.HookRequest;
import com.spiderhub.core.hook.HookResponse;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory transport. Routes are matched by URL prefix, longest first; unrouted
 * URLs answer 404. Every request is recorded after the request hooks ran.
 */
public class FakeTransport implements Transport {

    @FunctionalInterface
    public interface Responder {
        HookResponse respond(HookRequest request) throws IOException;
    }

    private final Map<String, Responder> routes = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final List<HookRequest> requests = new CopyOnWriteArrayList<>();

    public FakeTransport route(String urlPrefix, Responder responder) {
        routes.put(urlPrefix, responder);
        return this;
    }

    public FakeTransport respond(String urlPrefix, int status, String body) {
        return route(urlPrefix, request -> response(request, status, body));
    }

    public FakeTransport respond(String urlPrefix, String body) {
        return respond(urlPrefix, 200, body);
    }

    /**
     * Answers after a delay; an interrupt during the wait surfaces as an interrupted socket read.
     */
    public FakeTransport respondSlowly(String urlPrefix, long delayMs, String body) {
        return route(urlPrefix, request -> {
            pause(delayMs);
            return response(request, 200, body);
        });
    }

    public FakeTransport fail(String urlPrefix, String message) {
        return route(urlPrefix, request -> {
            throw new IOException(message);
        });
    }

    public static HookResponse response(HookRequest request, int status, String body) {
        return new HookResponse(request.getUrl(), status, Map.of(), body);
    }

    public static void pause(long delayMs) throws InterruptedIOException {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted");
        }
    }

    @Override
    public HookResponse execute(HookRequest request) throws IOException {
        requests.add(request.copy());
        String prefix = match(request.getUrl());
        if (prefix == null) {
            return response(request, 404, "not found");
        }
        calls.computeIfAbsent(prefix, k -> new AtomicInteger()).incrementAndGet();
        return routes.get(prefix).respond(request);
    }

    @Override
    public byte[] download(String url, Map<String, String> headers) throws IOException {
        HookRequest request = new HookRequest(url);
        headers.forEach(request::header);
        HookResponse response = execute(request);
        if (response.getStatusCode() >= 400) {
            throw new IOException("HTTP " + response.getStatusCode() + " for " + url);
        }
        return response.getBody().getBytes(StandardCharsets.UTF_8);
    }

    private String match(String url) {
        String best = null;
        for (String prefix : routes.keySet()) {
            if (url.startsWith(prefix) && (best == null || prefix.length() > best.length())) {
                best = prefix;
            }
        }
        return best;
    }

    /**
     * Requests that hit the route registered under {@code urlPrefix}.
     */
    public int calls(String urlPrefix) {
        AtomicInteger n = calls.get(urlPrefix);
        return n == null ? 0 : n.get();
    }

    public int totalRequests() {
        return requests.size();
    }

    public List<HookRequest> requests() {
        return new ArrayList<>(requests);
    }

    public HookRequest lastRequest() {
        return requests.isEmpty() ? null : requests.get(requests.size() - 1);
    }
}
