package com.spiderhub.api;

import java.util.List;
import java.util.Map;

/**
 * A site parser. Every content method returns the raw JSON text of the common
 * {@code vod_*} result shape; the engine normalizes it into an envelope.
 * Implementations may block on network I/O and must honour thread interruption.
 */
public interface Spider {

    // Called once per site before any content call. ext is the site's opaque backend payload.
    void init(SpiderContext context, String ext) throws Exception;

    String homeContent(boolean filter) throws Exception;

    String categoryContent(String tid, String pg, boolean filter, Map<String, String> extend) throws Exception;

    String detailContent(List<String> ids) throws Exception;

    String searchContent(String key, boolean quick) throws Exception;

    String playerContent(String flag, String id, List<String> vipFlags) throws Exception;

    // Release connections/handles. Called on engine shutdown.
    default void destroy() {
    }
}
