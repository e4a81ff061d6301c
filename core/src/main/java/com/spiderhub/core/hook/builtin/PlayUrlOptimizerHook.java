package com.spiderhub.core.hook.builtin;

import com.spiderhub.common.util.UrlUtils;
import com.spiderhub.core.hook.AbstractHook;
import com.spiderhub.core.hook.HookContext;
import com.spiderhub.core.hook.HookPlayerUrl;
import com.spiderhub.core.hook.HookResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cleans a play URL before it reaches the player: drops cache-busting and tracking
 * parameters, upgrades known TLS-capable hosts to https and adds the Referer/Origin
 * pair that the big platforms check.
 */
public class PlayUrlOptimizerHook extends AbstractHook<HookPlayerUrl> {
    private static final Logger logger = LoggerFactory.getLogger(PlayUrlOptimizerHook.class);
    public static final String NAME = "play-url-optimizer";

    static final Set<String> TRACKING_PARAMS = Set.of("t", "timestamp", "time", "r", "random", "cache", "_");
    static final Set<String> TRACKING_PREFIXES = Set.of("utm_");
    static final List<String> DEFAULT_TLS_MARKERS = List.of("cdn", "video", "youku", "iqiyi", "qq.com", "bilibili");

    private static final Map<String, String> PLATFORM_REFERERS = new LinkedHashMap<>();

    static {
        PLATFORM_REFERERS.put("youku.com", "https://www.youku.com/");
        PLATFORM_REFERERS.put("iqiyi.com", "https://www.iqiyi.com/");
        PLATFORM_REFERERS.put("qq.com", "https://v.qq.com/");
        PLATFORM_REFERERS.put("bilibili.com", "https://www.bilibili.com/");
    }

    private final List<String> tlsHostMarkers;
    private final Map<String, String> refererOverrides;

    public PlayUrlOptimizerHook(List<String> tlsHostMarkers, Map<String, String> refererOverrides) {
        super(NAME, 10);
        this.tlsHostMarkers = tlsHostMarkers == null || tlsHostMarkers.isEmpty() ? DEFAULT_TLS_MARKERS : List.copyOf(tlsHostMarkers);
        Map<String, String> referers = new LinkedHashMap<>(PLATFORM_REFERERS);
        if (refererOverrides != null) referers.putAll(refererOverrides);
        this.refererOverrides = referers;
    }

    @Override
    public boolean matches(HookContext context) {
        return context.url() != null && context.url().startsWith("http");
    }

    @Override
    public HookResult<HookPlayerUrl> execute(HookPlayerUrl player, HookContext context) {
        String original = player.getUrl();
        if (original == null || !original.startsWith("http")) {
            return HookResult.skip("not an http url");
        }

        String url = UrlUtils.removeQueryParams(original, TRACKING_PARAMS, TRACKING_PREFIXES);
        String host = UrlUtils.host(url);
        if (url.startsWith("http://") && tlsHostMarkers.stream().anyMatch(host::contains)) {
            url = "https://" + url.substring("http://".length());
        }
        player.setUrl(url);

        String referer = HostMatcher.lookup(refererOverrides, host);
        if (referer != null && !player.getHeaders().containsKey("Referer")) {
            player.getHeaders().put("Referer", referer);
            if (host.endsWith("bilibili.com")) {
                player.getHeaders().put("Origin", UrlUtils.origin(referer));
            }
        }

        if (!url.equals(original)) {
            logger.debug("🔧 Play URL optimized: {} -> {}", original, url);
        }
        return HookResult.success(player);
    }
}
