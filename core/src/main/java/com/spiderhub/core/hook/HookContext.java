package com.spiderhub.core.hook;

/**
 * Where a chain is running: which site, which URL, which phase.
 */
public record HookContext(String siteKey, String url, HookPhase phase) {
}
