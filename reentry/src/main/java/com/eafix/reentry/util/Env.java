package com.eafix.reentry.util;

import java.util.Optional;

/**
 * Settings that come from the process environment rather than the settings file.
 *
 * Each key is read as an environment variable first, then as a system property of the
 * same name; blank values count as unset.
 */
public final class Env {

    /** Path of the settings JSON when {@code --config} is not given. */
    public static final String CONFIG_PATH = "REENTRY_CONFIG";

    /** Print the Prometheus scrape to stderr after {@code process}. */
    public static final String PRINT_METRICS = "REENTRY_PRINT_METRICS";

    public static Optional<String> lookup(String key) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    public static boolean flag(String key) {
        return lookup(key)
            .map(v -> v.equalsIgnoreCase("true") || v.equals("1"))
            .orElse(false);
    }

    private Env() {}
}
