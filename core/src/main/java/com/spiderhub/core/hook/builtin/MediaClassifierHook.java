package com.spiderhub.core.hook.builtin;

import com.spiderhub.common.model.MediaKind;
import com.spiderhub.common.util.UrlUtils;
import com.spiderhub.core.hook.AbstractHook;
import com.spiderhub.core.hook.HookContext;
import com.spiderhub.core.hook.HookPlayerUrl;
import com.spiderhub.core.hook.HookResult;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a play URL is a media stream the player can open directly or a
 * page that still needs a parse pass. Direct media gets the default playback headers.
 */
public class MediaClassifierHook extends AbstractHook<HookPlayerUrl> {
    public static final String NAME = "media-classifier";

    static final Set<String> MEDIA_EXTENSIONS =
            Set.of("m3u8", "mp4", "flv", "avi", "mkv", "mov", "wmv", "webm", "ts", "m4a", "mp3");

    private static final Pattern EMBEDDED_MEDIA =
            Pattern.compile("https?://[^\\s\"'&?=]+\\.(m3u8|mp4|flv)(?:\\?[^\\s\"'&]*)?", Pattern.CASE_INSENSITIVE);

    private final String userAgent;

    public MediaClassifierHook(String userAgent) {
        super(NAME, 20);
        this.userAgent = userAgent == null || userAgent.isBlank() ? UserAgentHook.DEFAULT_USER_AGENT : userAgent;
    }

    @Override
    public HookResult<HookPlayerUrl> execute(HookPlayerUrl player, HookContext context) {
        String url = player.getUrl();
        if (url == null || url.isBlank()) {
            return HookResult.skip("no url");
        }

        String ext = UrlUtils.extension(url);
        if (MEDIA_EXTENSIONS.contains(ext)) {
            markDirect(player, ext);
            return HookResult.success(player);
        }

        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.contains("parse") || lower.contains("jx.") || lower.contains("?url=") || lower.contains("&url=")) {
            // Wrapper pages sometimes carry the real stream in a query parameter
            Matcher m = EMBEDDED_MEDIA.matcher(URLDecoder.decode(url, StandardCharsets.UTF_8));
            if (m.find() && !m.group().equals(url)) {
                player.setUrl(m.group());
                markDirect(player, m.group(1).toLowerCase(Locale.ROOT));
                return HookResult.success(player);
            }
            player.setNeedsParse(true);
            player.setMediaKind(MediaKind.NEEDS_PARSE);
            return HookResult.success(player);
        }

        return HookResult.skip("unclassified");
    }

    private void markDirect(HookPlayerUrl player, String ext) {
        player.setNeedsParse(false);
        player.setMediaKind(MediaKind.DIRECT);

        Map<String, String> headers = player.getHeaders();
        headers.putIfAbsent("User-Agent", userAgent);
        headers.putIfAbsent("Accept-Encoding", "identity");
        headers.putIfAbsent("Connection", "keep-alive");
        switch (ext) {
            case "m3u8" -> headers.putIfAbsent("Accept", "application/vnd.apple.mpegurl");
            case "mp4" -> {
                headers.putIfAbsent("Accept", "video/mp4,video/*;q=0.9,*/*;q=0.8");
                headers.putIfAbsent("Range", "bytes=0-");
            }
            default -> headers.putIfAbsent("Accept", "*/*");
        }
        if (!headers.containsKey("Referer")) {
            String origin = UrlUtils.origin(player.getUrl());
            if (!origin.isEmpty()) headers.put("Referer", origin + "/");
        }
    }
}
