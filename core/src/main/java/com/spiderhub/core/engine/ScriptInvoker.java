package com.spiderhub.core.engine;

import com.spiderhub.api.Invoker;
import com.spiderhub.api.ScriptRuntime;

/**
 * Forwards invoker calls to a script loaded in the {@link ScriptRuntime}.
 */
public class ScriptInvoker implements Invoker {
    private final ScriptRuntime runtime;
    private final String scriptId;

    public ScriptInvoker(ScriptRuntime runtime, String scriptId) {
        this.runtime = runtime;
        this.scriptId = scriptId;
    }

    @Override
    public String call(String function, Object... args) throws Exception {
        return runtime.invoke(scriptId, function, args);
    }

    @Override
    public void destroy() {
        runtime.unload(scriptId);
    }
}
