package com.spiderhub.plugins.m3u;

import com.spiderhub.api.Spider;
import com.spiderhub.api.SpiderProvider;
import com.spiderhub.plugins.m3u.internal.M3uSpider;

/**
 * Serves sites declared with api {@code csp_M3u}.
 */
public class M3uSpiderProvider implements SpiderProvider {

    @Override
    public String getName() {
        return "M3u";
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public Spider create() {
        return new M3uSpider();
    }
}
