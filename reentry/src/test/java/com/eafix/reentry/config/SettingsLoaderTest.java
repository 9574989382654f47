package com.eafix.reentry.config;

import com.eafix.reentry.domain.common.InvalidConfigurationException;
import com.eafix.reentry.domain.resolver.Tier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SettingsLoader and ReentrySettings defaults.
 *
 * Tests:
 * - Absent sections and keys take their defaults
 * - Partial sections keep their other defaults
 * - Unknown keys and missing files are rejected
 */
@DisplayName("Settings Loader Tests")
class SettingsLoaderTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Defaults")
    void testDefaults() {
        ReentrySettings settings = ReentrySettings.defaults();

        assertEquals(5.0, settings.classification().profitThresholdPips());
        assertEquals(-5.0, settings.classification().lossThresholdPips());
        assertEquals(30, settings.classification().quickMaxMinutes());
        assertEquals(15, settings.eligibility().cooldownMinutes());
        assertEquals(5, settings.eligibility().maxAttemptsPerDay());
        assertEquals(new BigDecimal("0.01"), settings.sizing().defaultLotStep());
        assertNull(settings.outcomeMapping().strongWinThresholdPips());
        assertEquals(Tier.defaultHierarchy(), settings.resolver().tierHierarchy());
        assertEquals("data/csv", settings.ledger().directory());
        assertTrue(settings.ledger().resumeSequence());
        assertNull(settings.vocabularyFile());
        assertEquals(4, settings.workerThreads());
    }

    @Test
    @DisplayName("Partial file keeps unspecified defaults")
    void testPartialFile() throws IOException {
        Path file = dir.resolve("settings.json");
        Files.writeString(file, """
            {
              "eligibility": { "cooldownMinutes": 0 },
              "sizing": { "lotSteps": { "XAUUSD": 0.1 } },
              "resolver": { "tierHierarchy": ["TIER1", "GLOBAL"] },
              "workerThreads": 2
            }
            """);

        ReentrySettings settings = SettingsLoader.load(file);

        assertEquals(0, settings.eligibility().cooldownMinutes());
        assertEquals(5, settings.eligibility().maxAttemptsPerDay());
        assertEquals(0, new BigDecimal("0.1").compareTo(settings.sizing().lotSteps().get("XAUUSD")));
        assertEquals(new BigDecimal("0.01"), settings.sizing().defaultLotStep());
        assertEquals(List.of(Tier.TIER1, Tier.GLOBAL), settings.resolver().tierHierarchy());
        assertEquals("config/parameter_sets.json", settings.resolver().parameterFile());
        assertEquals(2, settings.workerThreads());
    }

    @Test
    @DisplayName("Unknown keys are rejected")
    void testUnknownKey() throws IOException {
        Path file = dir.resolve("settings.json");
        Files.writeString(file, "{ \"eligibility\": { \"coolDown\": 5 } }");

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
            () -> SettingsLoader.load(file));
        assertTrue(e.getMessage().contains("coolDown"));
    }

    @Test
    @DisplayName("Missing file is rejected; no path means defaults")
    void testMissingFile() {
        assertThrows(InvalidConfigurationException.class, () -> SettingsLoader.load(dir.resolve("absent.json")));
        assertThrows(InvalidConfigurationException.class,
            () -> SettingsLoader.resolve(dir.resolve("absent.json").toString()));
    }
}
