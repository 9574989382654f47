package com.eafix.reentry.config;

import com.eafix.reentry.domain.common.InvalidConfigurationException;
import com.eafix.reentry.util.Env;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads {@link ReentrySettings} from JSON.
 *
 * Lookup order: explicit path, then {@code REENTRY_CONFIG} (environment or system
 * property), then built-in defaults.
 */
public final class SettingsLoader {
    private static final Logger log = LoggerFactory.getLogger(SettingsLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    private SettingsLoader() {}

    /**
     * @param explicitPath path given on the command line, may be null
     */
    public static ReentrySettings resolve(String explicitPath) {
        String path = explicitPath != null ? explicitPath : Env.lookup(Env.CONFIG_PATH).orElse(null);
        if (path == null) {
            log.info("No settings file configured, using defaults");
            return ReentrySettings.defaults();
        }
        return load(Paths.get(path));
    }

    /**
     * @throws InvalidConfigurationException if the file is missing, unreadable or has unknown keys
     */
    public static ReentrySettings load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new InvalidConfigurationException("Settings file not found: " + file);
        }
        try {
            ReentrySettings settings = MAPPER.readValue(Files.readString(file), ReentrySettings.class);
            log.info("✅ Loaded settings from: {}", file);
            return settings;
        } catch (IOException e) {
            throw new InvalidConfigurationException("Invalid settings file " + file + ": " + e.getMessage(), e);
        }
    }
}
