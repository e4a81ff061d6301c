package com.spiderhub.core.hook.builtin;

import com.spiderhub.common.util.UrlUtils;
import com.spiderhub.core.hook.AbstractHook;
import com.spiderhub.core.hook.HookContext;
import com.spiderhub.core.hook.HookRequest;
import com.spiderhub.core.hook.HookResult;

import java.util.Map;

/**
 * Adds a Referer (site origin, or a per-host override) when the request has none.
 */
public class RefererHook extends AbstractHook<HookRequest> {
    public static final String NAME = "referer";

    private final Map<String, String> hostOverrides;

    public RefererHook(Map<String, String> hostOverrides) {
        super(NAME, 20);
        this.hostOverrides = Map.copyOf(hostOverrides);
    }

    @Override
    public HookResult<HookRequest> execute(HookRequest request, HookContext context) {
        if (request.hasHeader("Referer")) {
            return HookResult.skip("referer present");
        }
        String referer = HostMatcher.lookup(hostOverrides, UrlUtils.host(request.getUrl()));
        if (referer == null) {
            String origin = UrlUtils.origin(request.getUrl());
            if (origin.isEmpty()) return HookResult.skip("no origin");
            referer = origin + "/";
        }
        request.header("Referer", referer);
        return HookResult.success(request);
    }
}
