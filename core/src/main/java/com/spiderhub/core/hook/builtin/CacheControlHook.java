package com.spiderhub.core.hook.builtin;

import com.spiderhub.core.hook.AbstractHook;
import com.spiderhub.core.hook.HookContext;
import com.spiderhub.core.hook.HookRequest;
import com.spiderhub.core.hook.HookResult;

public class CacheControlHook extends AbstractHook<HookRequest> {
    public static final String NAME = "cache-control";

    public CacheControlHook() {
        super(NAME, 30);
    }

    @Override
    public HookResult<HookRequest> execute(HookRequest request, HookContext context) {
        if (request.hasHeader("Cache-Control")) {
            return HookResult.skip("cache-control present");
        }
        request.header("Cache-Control", "no-cache");
        request.header("Pragma", "no-cache");
        return HookResult.success(request);
    }
}
