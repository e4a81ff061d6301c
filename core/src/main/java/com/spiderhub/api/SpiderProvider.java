package com.spiderhub.api;

/**
 * Factory for a module-backed spider. Module jars register implementations in
 * {@code META-INF/services/com.spiderhub.api.SpiderProvider}.
 */
public interface SpiderProvider {

    // Class name a site refers to, without the "csp_" prefix (e.g. "M3u" for api "csp_M3u").
    String getName();

    // Version string, logged on load.
    default String getVersion() {
        return "1.0.0";
    }

    // New spider instance per site.
    Spider create();
}
