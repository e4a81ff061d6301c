package com.spiderhub.core.hook.builtin;

import com.spiderhub.core.hook.AbstractHook;
import com.spiderhub.core.hook.HookContext;
import com.spiderhub.core.hook.HookResponse;
import com.spiderhub.core.hook.HookResult;

/**
 * Flags server errors and throttling responses as retryable.
 */
public class RetryMarkerHook extends AbstractHook<HookResponse> {
    public static final String NAME = "retry-marker";

    public RetryMarkerHook() {
        super(NAME, 100);
    }

    @Override
    public HookResult<HookResponse> execute(HookResponse response, HookContext context) {
        int code = response.getStatusCode();
        if (code >= 500 || code == 429 || code == 408) {
            response.getAttributes().put(HookResponse.ATTR_SHOULD_RETRY, "true");
            return HookResult.success(response);
        }
        return HookResult.skip("status " + code);
    }
}
