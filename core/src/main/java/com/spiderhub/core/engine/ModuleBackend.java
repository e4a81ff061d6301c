package com.spiderhub.core.engine;

import com.spiderhub.api.Invoker;
import com.spiderhub.api.ModuleHandle;
import com.spiderhub.api.ModuleLoader;
import com.spiderhub.api.Spider;
import com.spiderhub.api.SpiderContext;
import com.spiderhub.api.SpiderProvider;
import com.spiderhub.common.error.BackendInitException;
import com.spiderhub.common.model.Site;
import com.spiderhub.core.net.SiteHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Module-backed sites: resolve the site's jar, find the provider named by its
 * {@code csp_<Name>} api and initialize a fresh spider from it.
 */
public class ModuleBackend implements Backend {
    private static final Logger logger = LoggerFactory.getLogger(ModuleBackend.class);
    private static final String CLASS_PREFIX = "csp_";

    private final ModuleLoader loader;

    public ModuleBackend(ModuleLoader loader) {
        this.loader = loader;
    }

    @Override
    public BackendType type() {
        return BackendType.MODULE;
    }

    @Override
    public Invoker initialize(Site site, SiteHttpClient http) throws BackendInitException {
        String className = providerName(site.getApi());
        ModuleHandle handle = loader.resolve(site.getJar());
        SpiderProvider provider = handle.find(className)
                .orElseThrow(() -> new BackendInitException(
                        "Module class " + className + " not found in " + describe(handle)));

        Spider spider;
        try {
            spider = provider.create();
            spider.init(new SpiderContext(site, http), site.getExt());
        } catch (Exception e) {
            throw new BackendInitException("Spider " + className + " failed to init for " + site.getKey()
                    + ": " + e.getMessage(), e);
        }

        logger.info("🧩 Module spider {} v{} ready for {}", provider.getName(), provider.getVersion(), site.getKey());
        return new SpiderInvoker(spider);
    }

    static String providerName(String api) {
        String name = api == null ? "" : api.trim();
        return name.startsWith(CLASS_PREFIX) ? name.substring(CLASS_PREFIX.length()) : name;
    }

    private static String describe(ModuleHandle handle) {
        return handle.getRef().isEmpty() ? "built-in modules" : handle.getRef();
    }
}
