package com.spiderhub.core.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Reads and writes {@link EngineConfig} as JSON. A missing file is created with
 * defaults; an unreadable one falls back to defaults without touching the file.
 */
public class EngineConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfigLoader.class);

    private final File configFile;
    private final Gson gson;

    public EngineConfigLoader(File configFile) {
        this.configFile = configFile;
        this.gson = new GsonBuilder().setPrettyPrinting().create();
    }

    public EngineConfig load() {
        if (!configFile.exists()) {
            EngineConfig defaults = new EngineConfig();
            logger.info("No engine config at {}. Writing defaults.", configFile);
            save(defaults);
            return defaults;
        }

        try (Reader r = Files.newBufferedReader(configFile.toPath(), StandardCharsets.UTF_8)) {
            EngineConfig config = gson.fromJson(r, EngineConfig.class);
            if (config == null) config = new EngineConfig();
            logger.info("Engine configuration loaded from {}", configFile);
            return config;
        } catch (Exception e) {
            logger.error("Failed to load engine configuration, using defaults", e);
            return new EngineConfig();
        }
    }

    public synchronized void save(EngineConfig config) {
        File parent = configFile.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists()) parent.mkdirs();
        try (Writer w = Files.newBufferedWriter(configFile.toPath(), StandardCharsets.UTF_8)) {
            gson.toJson(config, w);
        } catch (IOException e) {
            logger.error("Failed to save engine configuration", e);
        }
    }
}
