package com.spiderhub.core.plugin;

import com.spiderhub.api.ModuleHandle;
import com.spiderhub.api.ModuleLoader;
import com.spiderhub.api.SpiderProvider;
import com.spiderhub.api.Transport;
import com.spiderhub.common.error.BackendInitException;
import com.spiderhub.common.error.SpiderException;
import com.spiderhub.common.model.Site;
import com.spiderhub.core.hook.HookManager;
import com.spiderhub.core.net.SiteHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Opens spider modules. A reference is either empty (providers registered in-process
 * plus those on the engine's own class path), a local jar path, or a jar URL that is
 * downloaded into the module directory first. A URL may end in {@code ;md5;<hex>} to
 * pin the jar's content. Each reference loads at most once at a time; callers of
 * other references never wait on it.
 */
public class JarModuleLoader implements ModuleLoader {
    private static final Logger logger = LoggerFactory.getLogger(JarModuleLoader.class);

    // downloads go out as this pseudo-site, so request hooks see them
    static final String MODULE_SITE_KEY = "modules";

    private final File moduleDir;
    private final SiteHttpClient http;

    private final Map<String, SpiderProvider> internalProviders = new ConcurrentHashMap<>();
    private volatile boolean classpathScanned = false;

    // Loaded jars and their ClassLoaders, so they can be closed again
    private final Map<String, LoadedModule> modules = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<LoadedModule>> loading = new ConcurrentHashMap<>();

    private static final class LoadedModule implements ModuleHandle {
        private final String ref;
        private final URLClassLoader classLoader;
        private final Map<String, SpiderProvider> providers;

        LoadedModule(String ref, URLClassLoader classLoader, Map<String, SpiderProvider> providers) {
            this.ref = ref;
            this.classLoader = classLoader;
            this.providers = providers;
        }

        @Override
        public String getRef() {
            return ref;
        }

        @Override
        public Collection<SpiderProvider> getProviders() {
            return providers.values();
        }
    }

    public JarModuleLoader(File moduleDir, Transport transport, HookManager hooks) {
        this.moduleDir = moduleDir;
        this.http = new SiteHttpClient(Site.builder().key(MODULE_SITE_KEY).name("Module downloads").build(),
                transport, hooks);
    }

    /**
     * Makes a provider available to sites with an empty module reference.
     */
    public void registerInternal(SpiderProvider provider) {
        SpiderProvider previous = internalProviders.put(key(provider.getName()), provider);
        if (previous != null && previous != provider) {
            logger.warn("Built-in spider {} replaced", provider.getName());
        } else {
            logger.info("Built-in spider registered: {} v{}", provider.getName(), provider.getVersion());
        }
    }

    @Override
    public ModuleHandle resolve(String moduleRef) throws BackendInitException {
        String ref = moduleRef == null ? "" : moduleRef.trim();
        if (ref.isEmpty()) {
            scanClasspathOnce();
            return new ModuleHandle() {
                @Override
                public String getRef() {
                    return "";
                }

                @Override
                public Collection<SpiderProvider> getProviders() {
                    return internalProviders.values();
                }
            };
        }

        LoadedModule loaded = modules.get(ref);
        if (loaded != null) return loaded;

        CompletableFuture<LoadedModule> mine = new CompletableFuture<>();
        CompletableFuture<LoadedModule> inFlight = loading.putIfAbsent(ref, mine);
        if (inFlight != null) {
            return await(ref, inFlight);
        }
        try {
            loaded = modules.get(ref);
            if (loaded == null) {
                loaded = load(ref);
                modules.put(ref, loaded);
            }
            mine.complete(loaded);
            return loaded;
        } catch (BackendInitException | RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            // failures are not remembered, the next resolve tries again
            loading.remove(ref, mine);
        }
    }

    private static LoadedModule await(String ref, CompletableFuture<LoadedModule> inFlight) throws BackendInitException {
        try {
            return inFlight.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendInitException("Interrupted waiting for module " + ref, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            throw new BackendInitException(cause.getMessage(), cause);
        }
    }

    private LoadedModule load(String ref) throws BackendInitException {
        File jar = localJar(ref);
        URLClassLoader ucl;
        try {
            URL[] urls = new URL[] { jar.toURI().toURL() };
            ucl = new URLClassLoader(urls, this.getClass().getClassLoader());
        } catch (IOException e) {
            throw new BackendInitException("Cannot open module " + jar + ": " + e.getMessage(), e);
        }

        Map<String, SpiderProvider> providers = new LinkedHashMap<>();
        try {
            for (SpiderProvider provider : ServiceLoader.load(SpiderProvider.class, ucl)) {
                // the parent loader's providers are visible too; keep only the jar's own
                if (provider.getClass().getClassLoader() != ucl) continue;
                if (providers.putIfAbsent(key(provider.getName()), provider) != null) {
                    logger.warn("Spider {} is provided twice in {}. Skipping duplicate.", provider.getName(), ref);
                }
            }
        } catch (ServiceConfigurationError e) {
            closeQuietly(ref, ucl);
            throw new BackendInitException("Broken provider registration in " + ref + ": " + e.getMessage(), e);
        }

        if (providers.isEmpty()) {
            closeQuietly(ref, ucl);
            throw new BackendInitException("No spider providers found in " + ref);
        }
        logger.info("🔌 Module loaded: {} ({} spiders: {})", ref, providers.size(), providers.keySet());
        return new LoadedModule(ref, ucl, providers);
    }

    private File localJar(String ref) throws BackendInitException {
        String location = ref;
        String expectedMd5 = null;
        int marker = ref.indexOf(";md5;");
        if (marker >= 0) {
            location = ref.substring(0, marker);
            expectedMd5 = ref.substring(marker + ";md5;".length()).trim().toLowerCase(Locale.ROOT);
        }

        File jar;
        if (location.startsWith("http://") || location.startsWith("https://")) {
            jar = new File(moduleDir, digest("SHA-256", location.getBytes(StandardCharsets.UTF_8)) + ".jar");
            if (!jar.exists() || (expectedMd5 != null && !expectedMd5.equals(md5(jar)))) {
                download(location, jar);
            }
        } else {
            jar = new File(location.startsWith("file://") ? location.substring("file://".length()) : location);
            if (!jar.isFile()) {
                throw new BackendInitException("Module jar not found: " + jar);
            }
        }

        if (expectedMd5 != null && !expectedMd5.equals(md5(jar))) {
            throw new BackendInitException("Module " + location + " failed its md5 check");
        }
        return jar;
    }

    private void download(String url, File target) throws BackendInitException {
        if (!moduleDir.exists()) moduleDir.mkdirs();
        try {
            byte[] bytes = http.download(url);
            File tmp = new File(moduleDir, target.getName() + ".part");
            Files.write(tmp.toPath(), bytes);
            Files.move(tmp.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING);
            logger.info("⬇️ Module downloaded: {} ({} bytes)", url, bytes.length);
        } catch (SpiderException | IOException e) {
            throw new BackendInitException("Module download failed: " + url + ": " + e.getMessage(), e);
        }
    }

    private synchronized void scanClasspathOnce() {
        if (classpathScanned) return;
        classpathScanned = true;
        for (SpiderProvider provider : ServiceLoader.load(SpiderProvider.class, this.getClass().getClassLoader())) {
            if (internalProviders.putIfAbsent(key(provider.getName()), provider) == null) {
                logger.info("Class path spider discovered: {} v{}", provider.getName(), provider.getVersion());
            }
        }
    }

    public void unload(String moduleRef) {
        LoadedModule module = modules.remove(moduleRef);
        if (module == null) {
            logger.warn("Cannot unload unknown module: {}", moduleRef);
            return;
        }
        closeQuietly(moduleRef, module.classLoader);
        logger.info("🗑️ Module {} unloaded.", moduleRef);
    }

    public List<String> getLoadedModules() {
        return new ArrayList<>(modules.keySet());
    }

    @Override
    public void close() {
        for (String ref : new ArrayList<>(modules.keySet())) {
            unload(ref);
        }
    }

    private static void closeQuietly(String ref, URLClassLoader ucl) {
        try {
            ucl.close();
        } catch (IOException e) {
            logger.warn("Failed to close ClassLoader for {}", ref, e);
        }
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static String md5(File file) throws BackendInitException {
        try {
            return digest("MD5", Files.readAllBytes(file.toPath()));
        } catch (IOException e) {
            throw new BackendInitException("Cannot read module " + file + ": " + e.getMessage(), e);
        }
    }

    private static String digest(String algorithm, byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance(algorithm).digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
