package com.spiderhub.core.hook.builtin;

import com.spiderhub.common.model.MediaKind;
import com.spiderhub.core.config.EngineConfig;
import com.spiderhub.core.hook.HookManager;
import com.spiderhub.core.hook.HookPlayerUrl;
import com.spiderhub.test.TestBase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the player URL chain: optimizer then classifier
 */
class PlayerHooksTest extends TestBase {

    private HookManager hooks;

    @BeforeEach
    void createHooks() {
        hooks = new HookManager(new EngineConfig());
    }

    @AfterEach
    void stopHooks() {
        hooks.shutdown();
    }

    private HookPlayerUrl process(String url) {
        HookPlayerUrl player = new HookPlayerUrl(url);
        player.setFlag("line1");
        return hooks.processPlayerUrl("site", player);
    }

    @Test
    void testHlsIsDirectWithPlaybackHeaders() {
        HookPlayerUrl out = process("https://media.example.com/v/index.m3u8");

        assertEquals(MediaKind.DIRECT, out.getMediaKind());
        assertFalse(out.isNeedsParse());
        assertEquals("application/vnd.apple.mpegurl", out.getHeaders().get("Accept"));
        assertEquals("https://media.example.com/", out.getHeaders().get("Referer"));
        assertNotNull(out.getHeaders().get("User-Agent"));
    }

    @Test
    void testParsePageNeedsParsing() {
        HookPlayerUrl out = process("https://jx.example.com/player?vid=abc");

        assertEquals(MediaKind.NEEDS_PARSE, out.getMediaKind());
        assertTrue(out.isNeedsParse());
    }

    @Test
    void testEmbeddedMediaIsExtracted() {
        HookPlayerUrl out = process("https://jx.example.com/?url=https%3A%2F%2Fcdn.example.com%2Fa%2Fb.mp4");

        assertEquals("https://cdn.example.com/a/b.mp4", out.getUrl());
        assertEquals(MediaKind.DIRECT, out.getMediaKind());
        assertEquals("bytes=0-", out.getHeaders().get("Range"));
    }

    @Test
    void testTrackingParamsStrippedAndTlsUpgraded() {
        HookPlayerUrl out = process("http://video.example.com/v/1.m3u8?t=123&utm_source=x&token=keep");

        assertEquals("https://video.example.com/v/1.m3u8?token=keep", out.getUrl());
    }

    @Test
    void testPlatformRefererAndOrigin() {
        HookPlayerUrl out = process("https://www.bilibili.com/video/BV1xx");

        assertEquals("https://www.bilibili.com/", out.getHeaders().get("Referer"));
        assertEquals("https://www.bilibili.com", out.getHeaders().get("Origin"));
    }

    @Test
    void testUnclassifiedKeepsBackendFlag() {
        HookPlayerUrl player = new HookPlayerUrl("https://site.example.com/play/42");
        player.setNeedsParse(true);

        HookPlayerUrl out = hooks.processPlayerUrl("site", player);

        assertTrue(out.isNeedsParse());
        assertEquals(MediaKind.UNKNOWN, out.getMediaKind());
    }
}
