package com.spiderhub.core.hook.builtin;

import com.spiderhub.common.util.UrlUtils;
import com.spiderhub.core.hook.AbstractHook;
import com.spiderhub.core.hook.HookContext;
import com.spiderhub.core.hook.HookRequest;
import com.spiderhub.core.hook.HookResult;

import java.util.Locale;
import java.util.Map;

/**
 * Replaces a missing or library-default User-Agent with a browser one.
 * Per-host overrides win over the default.
 */
public class UserAgentHook extends AbstractHook<HookRequest> {
    public static final String NAME = "user-agent";
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private final String defaultUserAgent;
    private final Map<String, String> hostOverrides;

    public UserAgentHook(String defaultUserAgent, Map<String, String> hostOverrides) {
        super(NAME, 10);
        this.defaultUserAgent = defaultUserAgent == null || defaultUserAgent.isBlank() ? DEFAULT_USER_AGENT : defaultUserAgent;
        this.hostOverrides = Map.copyOf(hostOverrides);
    }

    @Override
    public HookResult<HookRequest> execute(HookRequest request, HookContext context) {
        String host = UrlUtils.host(request.getUrl());
        String override = HostMatcher.lookup(hostOverrides, host);
        if (override != null) {
            request.header("User-Agent", override);
            return HookResult.success(request);
        }

        String current = request.getHeader("User-Agent");
        if (current == null || current.isBlank() || isLibraryDefault(current)) {
            request.header("User-Agent", defaultUserAgent);
            return HookResult.success(request);
        }
        return HookResult.skip("user agent already set");
    }

    private static boolean isLibraryDefault(String ua) {
        String l = ua.toLowerCase(Locale.ROOT);
        return l.startsWith("okhttp") || l.startsWith("java/") || l.startsWith("jsoup") || l.startsWith("dalvik");
    }
}
