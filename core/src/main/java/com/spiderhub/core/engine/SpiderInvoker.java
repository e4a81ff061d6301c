package com.spiderhub.core.engine;

import com.spiderhub.api.Invoker;
import com.spiderhub.api.Spider;

import java.util.List;
import java.util.Map;

/**
 * Dispatches invoker calls onto an in-process {@link Spider}.
 */
public class SpiderInvoker implements Invoker {
    private final Spider spider;

    public SpiderInvoker(Spider spider) {
        this.spider = spider;
    }

    public Spider getSpider() {
        return spider;
    }

    @Override
    @SuppressWarnings("unchecked")
    public String call(String function, Object... args) throws Exception {
        switch (function) {
            case "homeContent":
                return spider.homeContent((Boolean) args[0]);
            case "categoryContent":
                return spider.categoryContent((String) args[0], (String) args[1], (Boolean) args[2],
                        (Map<String, String>) args[3]);
            case "detailContent":
                return spider.detailContent((List<String>) args[0]);
            case "searchContent":
                return spider.searchContent((String) args[0], (Boolean) args[1]);
            case "playerContent":
                return spider.playerContent((String) args[0], (String) args[1], (List<String>) args[2]);
            default:
                throw new IllegalArgumentException("Unknown spider function: " + function);
        }
    }

    @Override
    public void destroy() {
        spider.destroy();
    }
}
