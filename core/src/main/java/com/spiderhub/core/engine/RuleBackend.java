package com.spiderhub.core.engine;

import com.spiderhub.api.Invoker;
import com.spiderhub.api.Spider;
import com.spiderhub.api.SpiderContext;
import com.spiderhub.common.error.BackendInitException;
import com.spiderhub.common.model.Site;
import com.spiderhub.common.model.SiteKind;
import com.spiderhub.common.util.UrlUtils;
import com.spiderhub.core.engine.rule.HtmlRuleSpider;
import com.spiderhub.core.engine.rule.JsonApiSpider;
import com.spiderhub.core.engine.rule.RuleConfig;
import com.spiderhub.core.net.SiteHttpClient;

/**
 * In-process rule engine: JSON API sites get {@link JsonApiSpider}, everything else
 * {@link HtmlRuleSpider}. Also provides the default-rule fallback for sites whose
 * preferred backend could not start.
 */
public class RuleBackend implements Backend {

    @Override
    public BackendType type() {
        return BackendType.RULE;
    }

    @Override
    public Invoker initialize(Site site, SiteHttpClient http) throws BackendInitException {
        Spider spider = site.getKind() == SiteKind.JSON_API ? new JsonApiSpider() : new HtmlRuleSpider();
        return start(spider, site, http);
    }

    /**
     * Best-effort spider with default rules, rooted at whatever http origin the site declares.
     */
    public Invoker initializeDefault(Site site, SiteHttpClient http) throws BackendInitException {
        String api = site.getApi();
        if (site.getKind() != SiteKind.JSON_API && JsonApiSpider.looksLikeApiUrl(api)) {
            return start(new JsonApiSpider(), site, http);
        }

        String base = UrlUtils.origin(api);
        if (base.isEmpty() || api.endsWith(".js")) {
            String ext = site.getExt().trim();
            base = ext.startsWith("http") ? UrlUtils.origin(ext) : base;
        }
        if (base.isEmpty()) {
            throw new BackendInitException("No http base URL to apply default rules for " + site.getKey());
        }
        return start(new HtmlRuleSpider(RuleConfig.defaults(base)), site, http);
    }

    private static Invoker start(Spider spider, Site site, SiteHttpClient http) throws BackendInitException {
        try {
            spider.init(new SpiderContext(site, http), site.getExt());
        } catch (Exception e) {
            throw new BackendInitException("Rule spider init failed for " + site.getKey() + ": " + e.getMessage(), e);
        }
        return new SpiderInvoker(spider);
    }
}
