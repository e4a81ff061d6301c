package com.spiderhub.common.model;

import java.util.Locale;

/**
 * Declared parser kind of a site.
 */
public enum SiteKind {
    RULE_HTML,
    JSON_API,
    SCRIPT,
    MODULE;

    /**
     * Maps the numeric site type of a source config and its api string onto a kind.
     * Type 3 means "custom parser": a {@code .js} api is a script, anything else a module class.
     */
    public static SiteKind resolve(int type, String api) {
        String a = api == null ? "" : api.trim().toLowerCase(Locale.ROOT);
        if (type == 3) {
            if (a.endsWith(".js") || a.contains(".js?")) return SCRIPT;
            return MODULE;
        }
        if (a.startsWith("csp_")) return MODULE;
        if (type == 1 || a.contains("/api.php/provide/vod") || a.endsWith(".json")) return JSON_API;
        return RULE_HTML;
    }

    public static SiteKind fromName(String name) {
        if (name == null) return null;
        try {
            return SiteKind.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
