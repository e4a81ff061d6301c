package com.spiderhub.core.net;

import com.spiderhub.api.Transport;
import com.spiderhub.core.hook.HookRequest;
import com.spiderhub.core.hook.HookResponse;
import org.jsoup.Connection;
import org.jsoup.Jsoup;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;

/**
 * Default transport on top of jsoup's HTTP client. Non-2xx statuses come back as
 * responses; classification happens in {@link SiteHttpClient}.
 */
public class JsoupTransport implements Transport {
    private final int defaultTimeoutMs;

    public JsoupTransport(int defaultTimeoutMs) {
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    @Override
    public HookResponse execute(HookRequest request) throws IOException {
        Connection conn = connect(request.getUrl(), request.getHeaders(),
                request.getTimeoutMs() > 0 ? (int) request.getTimeoutMs() : defaultTimeoutMs)
                .method(Connection.Method.valueOf(request.getMethod().toUpperCase(Locale.ROOT)));
        if (request.getBody() != null) {
            conn.requestBody(request.getBody());
        }

        Connection.Response res = conn.execute();
        return new HookResponse(res.url().toString(), res.statusCode(), res.headers(), res.body());
    }

    @Override
    public byte[] download(String url, Map<String, String> headers) throws IOException {
        Connection.Response res = connect(url, headers, defaultTimeoutMs).execute();
        if (res.statusCode() >= 400) {
            throw new IOException("HTTP " + res.statusCode() + " downloading " + url);
        }
        return res.bodyAsBytes();
    }

    private Connection connect(String url, Map<String, String> headers, int timeoutMs) {
        return Jsoup.connect(url)
                .headers(headers)
                .timeout(timeoutMs)
                .maxBodySize(0)
                .followRedirects(true)
                .ignoreContentType(true)
                .ignoreHttpErrors(true);
    }
}
