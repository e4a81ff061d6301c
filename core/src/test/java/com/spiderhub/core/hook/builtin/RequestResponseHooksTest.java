package com.spiderhub.core.hook.builtin;

import com.spiderhub.core.hook.HookContext;
import com.spiderhub.core.hook.HookPhase;
import com.spiderhub.core.hook.HookRequest;
import com.spiderhub.core.hook.HookResponse;
import com.spiderhub.test.TestBase;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the built-in request and response hooks
 */
class RequestResponseHooksTest extends TestBase {

    private static HookContext ctx(String url, HookPhase phase) {
        return new HookContext("site", url, phase);
    }

    @Test
    void testUserAgentAddedAndLibraryDefaultReplaced() throws Exception {
        UserAgentHook hook = new UserAgentHook("", Map.of());

        HookRequest bare = new HookRequest("https://a.example.com/x");
        hook.execute(bare, ctx(bare.getUrl(), HookPhase.REQUEST));
        assertEquals(UserAgentHook.DEFAULT_USER_AGENT, bare.getHeader("User-Agent"));

        HookRequest okhttp = new HookRequest("https://a.example.com/x").header("User-Agent", "okhttp/4.12.0");
        hook.execute(okhttp, ctx(okhttp.getUrl(), HookPhase.REQUEST));
        assertEquals(UserAgentHook.DEFAULT_USER_AGENT, okhttp.getHeader("User-Agent"));

        HookRequest custom = new HookRequest("https://a.example.com/x").header("User-Agent", "MyPlayer/1.0");
        hook.execute(custom, ctx(custom.getUrl(), HookPhase.REQUEST));
        assertEquals("MyPlayer/1.0", custom.getHeader("User-Agent"), "Explicit agents are kept");
    }

    @Test
    void testUserAgentPerHost() throws Exception {
        UserAgentHook hook = new UserAgentHook("", Map.of("example.com", "Special/2.0"));

        HookRequest request = new HookRequest("https://cdn.example.com/x");
        hook.execute(request, ctx(request.getUrl(), HookPhase.REQUEST));

        assertEquals("Special/2.0", request.getHeader("User-Agent"), "Parent domain override applies");
    }

    @Test
    void testRefererDefaultsToOrigin() throws Exception {
        RefererHook hook = new RefererHook(Map.of());
        HookRequest request = new HookRequest("https://site.example.com/path/page.html?x=1");

        hook.execute(request, ctx(request.getUrl(), HookPhase.REQUEST));

        assertEquals("https://site.example.com/", request.getHeader("Referer"));
    }

    @Test
    void testCacheControlAddedWhenAbsent() throws Exception {
        CacheControlHook hook = new CacheControlHook();
        HookRequest request = new HookRequest("https://site.example.com/");

        hook.execute(request, ctx(request.getUrl(), HookPhase.REQUEST));

        assertEquals("no-cache", request.getHeader("Cache-Control"));
        assertEquals("no-cache", request.getHeader("Pragma"));
    }

    @Test
    void testContentTypeDetection() {
        assertEquals("application/json", ContentTypeHook.detect("  {\"a\":1}"));
        assertEquals("application/vnd.apple.mpegurl", ContentTypeHook.detect("#EXTM3U\n#EXTINF:-1,x"));
        assertEquals("text/html", ContentTypeHook.detect("<!DOCTYPE html><html></html>"));
        assertEquals("text/plain", ContentTypeHook.detect("just words"));
    }

    @Test
    void testCharsetFromMetaTag() throws Exception {
        HookResponse response = new HookResponse("https://x/", 200, Map.of(),
                "<html><head><meta charset=\"gbk\"></head><body></body></html>");

        new ContentTypeHook().execute(response, ctx("https://x/", HookPhase.RESPONSE));
        new EncodingHook().execute(response, ctx("https://x/", HookPhase.RESPONSE));

        assertEquals("text/html; charset=GBK", response.getContentType());
    }

    @Test
    void testCharsetFromUnusualMetaMarkup() throws Exception {
        HookResponse singleQuoted = new HookResponse("https://x/", 200, Map.of(),
                "<HTML><HEAD><META CHARSET='gb2312'></HEAD></HTML>");
        HookResponse httpEquiv = new HookResponse("https://x/", 200, Map.of(),
                "<html><head><meta name=\"x\" content=\"charset=latin1\">"
                        + "<meta content=\"text/html; CHARSET=Big5\" http-equiv=\"Content-Type\"></head></html>");
        HookResponse bogus = new HookResponse("https://x/", 200, Map.of(),
                "<html><head><meta charset=\"no-such-charset!\"></head></html>");

        for (HookResponse response : new HookResponse[] { singleQuoted, httpEquiv, bogus }) {
            new ContentTypeHook().execute(response, ctx("https://x/", HookPhase.RESPONSE));
            new EncodingHook().execute(response, ctx("https://x/", HookPhase.RESPONSE));
        }

        assertEquals("text/html; charset=GB2312", singleQuoted.getContentType());
        assertEquals("text/html; charset=BIG5", httpEquiv.getContentType(), "http-equiv declaration is honoured");
        assertEquals("text/html; charset=UTF-8", bogus.getContentType(), "Unknown charsets fall back to UTF-8");
    }

    @Test
    void testRetryMarker() throws Exception {
        RetryMarkerHook hook = new RetryMarkerHook();
        HookResponse unavailable = new HookResponse("https://x/", 503, Map.of(), "");
        HookResponse missing = new HookResponse("https://x/", 404, Map.of(), "");

        hook.execute(unavailable, ctx("https://x/", HookPhase.RESPONSE));
        hook.execute(missing, ctx("https://x/", HookPhase.RESPONSE));

        assertTrue(unavailable.isMarkedRetry());
        assertFalse(missing.isMarkedRetry());
    }
}
