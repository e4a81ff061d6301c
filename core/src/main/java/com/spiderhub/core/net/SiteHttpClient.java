package com.spiderhub.core.net;

import com.spiderhub.api.Transport;
import com.spiderhub.common.error.PermanentUpstreamException;
import com.spiderhub.common.error.SpiderException;
import com.spiderhub.common.error.TransientNetworkException;
import com.spiderhub.common.model.Site;
import com.spiderhub.core.hook.HookManager;
import com.spiderhub.core.hook.HookRequest;
import com.spiderhub.core.hook.HookResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Map;

/**
 * HTTP access for one site. Site headers are applied first, then the request hook
 * chain; the response goes through the response chain before its status is checked.
 */
public class SiteHttpClient {
    private static final Logger logger = LoggerFactory.getLogger(SiteHttpClient.class);

    private final Site site;
    private final Transport transport;
    private final HookManager hooks;

    public SiteHttpClient(Site site, Transport transport, HookManager hooks) {
        this.site = site;
        this.transport = transport;
        this.hooks = hooks;
    }

    public Site getSite() {
        return site;
    }

    public String get(String url) throws SpiderException {
        return get(url, Map.of());
    }

    public String get(String url, Map<String, String> headers) throws SpiderException {
        HookRequest request = new HookRequest(url, "GET");
        headers.forEach(request::header);
        return execute(request).getBody();
    }

    public String post(String url, String body, Map<String, String> headers) throws SpiderException {
        HookRequest request = new HookRequest(url, "POST");
        headers.forEach(request::header);
        request.setBody(body);
        return execute(request).getBody();
    }

    /**
     * Runs a request through hooks and transport.
     *
     * @throws TransientNetworkException on I/O failure, 408/429 or 5xx
     * @throws PermanentUpstreamException on any other 4xx
     */
    public HookResponse execute(HookRequest request) throws SpiderException {
        HookRequest prepared = withSiteHeaders(request);
        prepared = hooks.processRequest(site.getKey(), prepared);

        HookResponse response;
        try {
            response = transport.execute(prepared);
        } catch (InterruptedIOException e) {
            throw new TransientNetworkException("Timed out: " + prepared.getUrl(), e);
        } catch (IOException e) {
            throw new TransientNetworkException(e.getClass().getSimpleName() + " fetching " + prepared.getUrl(), e);
        }

        response = hooks.processResponse(site.getKey(), response);
        int code = response.getStatusCode();
        if (response.isMarkedRetry() || code >= 500 || code == 408 || code == 429) {
            throw new TransientNetworkException("HTTP " + code + " from " + prepared.getUrl());
        }
        if (code >= 400) {
            throw new PermanentUpstreamException("HTTP " + code + " from " + prepared.getUrl());
        }
        logger.debug("[{}] {} -> {}", site.getKey(), prepared, code);
        return response;
    }

    /**
     * Binary download (scripts, module jars) with the request hooks applied to its headers.
     */
    public byte[] download(String url) throws SpiderException {
        HookRequest prepared = hooks.processRequest(site.getKey(), withSiteHeaders(new HookRequest(url, "GET")));
        try {
            return transport.download(prepared.getUrl(), prepared.getHeaders());
        } catch (IOException e) {
            throw new TransientNetworkException("Download failed: " + url, e);
        }
    }

    private HookRequest withSiteHeaders(HookRequest request) {
        for (Map.Entry<String, String> h : site.getHeaders().entrySet()) {
            if (!request.hasHeader(h.getKey())) request.header(h.getKey(), h.getValue());
        }
        if (request.getTimeoutMs() <= 0 && site.getTimeoutMs() > 0) {
            request.setTimeoutMs(site.getTimeoutMs());
        }
        return request;
    }
}
