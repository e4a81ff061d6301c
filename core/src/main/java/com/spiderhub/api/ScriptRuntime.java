package com.spiderhub.api;

/**
 * Bridge to an embedded scripting runtime. The engine owns script lifecycles but
 * never touches the interpreter directly.
 */
public interface ScriptRuntime {

    /**
     * Evaluates a script body and keeps it addressable under {@code scriptId}.
     *
     * @throws Exception if the script does not compile or its top level throws
     */
    void load(String scriptId, String source) throws Exception;

    /**
     * Calls an exported function of a loaded script. Arguments are plain Java values
     * (strings, booleans, lists, maps); the result is the function's JSON text.
     */
    String invoke(String scriptId, String function, Object... args) throws Exception;

    void unload(String scriptId);
}
