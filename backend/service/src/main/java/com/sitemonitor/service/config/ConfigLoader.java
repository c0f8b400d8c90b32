package com.sitemonitor.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.sitemonitor.core.util.JsonUtils;
import com.sitemonitor.sites.web.WebPageSitesConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public final class ConfigLoader {
    public static final String CONFIG_DIR_ENV = "MONITOR_CONFIG_DIR";
    static final String MONITOR_FILE = "monitor.json";
    static final String SITES_FILE = "sites.json";

    private ConfigLoader() {
    }

    public static Path resolveConfigDir(Map<String, String> environment) {
        String override = environment.get(CONFIG_DIR_ENV);
        return override == null || override.isBlank() ? Path.of("config") : Path.of(override);
    }

    public static MonitorConfig loadMonitor(Path configDir) {
        return read(configDir.resolve(MONITOR_FILE), new TypeReference<>() {
        });
    }

    /**
     * Web page sites are optional: no {@code sites.json} means none are watched.
     */
    public static WebPageSitesConfig loadSites(Path configDir) {
        Path path = configDir.resolve(SITES_FILE);
        if (!Files.exists(path)) {
            return WebPageSitesConfig.empty();
        }
        return read(path, new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            T value = JsonUtils.objectMapper().readValue(in, ref);
            if (value == null) {
                throw new IllegalStateException("Config file is empty: " + path);
            }
            return value;
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
