package com.spiderhub.core.hook.builtin;

import java.util.Map;

final class HostMatcher {

    private HostMatcher() {
    }

    /**
     * Value for the most specific configured host that equals {@code host} or is a parent domain of it.
     */
    static String lookup(Map<String, String> byHost, String host) {
        if (host == null || host.isEmpty() || byHost.isEmpty()) return null;
        String best = null;
        int bestLen = -1;
        for (Map.Entry<String, String> e : byHost.entrySet()) {
            String h = e.getKey().toLowerCase();
            if ((host.equals(h) || host.endsWith("." + h)) && h.length() > bestLen) {
                best = e.getValue();
                bestLen = h.length();
            }
        }
        return best;
    }
}
