package com.spiderhub.test;

import com.spiderhub.api.Spider;
import com.spiderhub.api.SpiderProvider;

/**
 * Hands out one shared {@link StubSpider}; also registered for class path discovery as "Stub".
 */
public class StubSpiderProvider implements SpiderProvider {
    private final String name;
    private final StubSpider spider;

    public StubSpiderProvider() {
        this("Stub", new StubSpider());
    }

    public StubSpiderProvider(String name, StubSpider spider) {
        this.name = name;
        this.spider = spider;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Spider create() {
        return spider;
    }

    public StubSpider getSpider() {
        return spider;
    }
}
