package com.spiderhub.core.engine;

import com.spiderhub.api.Invoker;
import com.spiderhub.api.ScriptRuntime;
import com.spiderhub.common.error.BackendInitException;
import com.spiderhub.common.error.SpiderException;
import com.spiderhub.common.model.Site;
import com.spiderhub.core.net.SiteHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Script-backed sites: fetch the script named by the site's api, load it into the
 * runtime under the site key and call its {@code init(ext)}.
 */
public class ScriptBackend implements Backend {
    private static final Logger logger = LoggerFactory.getLogger(ScriptBackend.class);

    private final ScriptRuntime runtime;

    /**
     * @param runtime may be null, in which case every script site falls back to rules
     */
    public ScriptBackend(ScriptRuntime runtime) {
        this.runtime = runtime;
    }

    @Override
    public BackendType type() {
        return BackendType.SCRIPT;
    }

    @Override
    public Invoker initialize(Site site, SiteHttpClient http) throws BackendInitException {
        if (runtime == null) {
            throw new BackendInitException("No script runtime configured for " + site.getKey());
        }

        String source = fetchSource(site, http);
        String scriptId = site.getKey();
        try {
            runtime.load(scriptId, source);
        } catch (Exception e) {
            throw new BackendInitException("Script failed to load for " + site.getKey() + ": " + e.getMessage(), e);
        }

        try {
            runtime.invoke(scriptId, "init", site.getExt());
        } catch (Exception e) {
            runtime.unload(scriptId);
            throw new BackendInitException("Script init failed for " + site.getKey() + ": " + e.getMessage(), e);
        }

        logger.info("📜 Script loaded for {} ({} chars)", site.getKey(), source.length());
        return new ScriptInvoker(runtime, scriptId);
    }

    private String fetchSource(Site site, SiteHttpClient http) throws BackendInitException {
        String api = site.getApi();
        try {
            if (api.startsWith("http://") || api.startsWith("https://")) {
                return new String(http.download(api), StandardCharsets.UTF_8);
            }
            String path = api.startsWith("file://") ? api.substring("file://".length()) : api;
            return Files.readString(Path.of(path), StandardCharsets.UTF_8);
        } catch (SpiderException | IOException e) {
            throw new BackendInitException("Could not fetch script " + api + ": " + e.getMessage(), e);
        }
    }
}
