package com.eafix.reentry.bootstrap;

import com.eafix.reentry.config.ReentrySettings;
import com.eafix.reentry.config.ReentrySettings.ClassificationSettings;
import com.eafix.reentry.config.ReentrySettings.EligibilitySettings;
import com.eafix.reentry.config.ReentrySettings.OutcomeMappingSettings;
import com.eafix.reentry.config.ReentrySettings.ResolverSettings;
import com.eafix.reentry.config.ReentrySettings.SizingSettings;
import com.eafix.reentry.domain.common.InvalidConfigurationException;
import com.eafix.reentry.domain.resolver.Tier;
import com.eafix.reentry.domain.vocab.ReentryVocabulary;
import com.eafix.reentry.domain.vocab.VocabularyDefinition;
import com.eafix.reentry.domain.vocab.VocabularyDefinition.OutcomeBucket;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StartupConfigValidator.
 *
 * Tests:
 * - Defaults pass
 * - Every problem is collected before failing
 * - Strong thresholds need matching vocabulary tokens
 */
@DisplayName("Startup Config Validator Tests")
class StartupConfigValidatorTest {

    private static ReentrySettings settings(ClassificationSettings classification,
                                            EligibilitySettings eligibility,
                                            SizingSettings sizing,
                                            OutcomeMappingSettings mapping,
                                            ResolverSettings resolver,
                                            Integer workerThreads) {
        return new ReentrySettings(classification, eligibility, sizing, mapping, resolver, null, null,
            workerThreads, null);
    }

    @Test
    @DisplayName("Defaults and the sample strong thresholds pass")
    void testDefaultsPass() {
        ReentryVocabulary vocabulary = ReentryVocabulary.defaults();
        assertDoesNotThrow(() -> StartupConfigValidator.validate(ReentrySettings.defaults(), vocabulary));
        assertDoesNotThrow(() -> StartupConfigValidator.validate(
            settings(null, null, null, new OutcomeMappingSettings(40.0, -40.0), null, null), vocabulary));
    }

    @Test
    @DisplayName("All problems are reported together")
    void testCollectsProblems() {
        ReentrySettings bad = settings(
            new ClassificationSettings(-5.0, 5.0, 30, 10, 240),
            new EligibilitySettings(true, -1.0, false, -1, 0),
            new SizingSettings(BigDecimal.ZERO, Map.of("XAUUSD", new BigDecimal("-0.1"))),
            null,
            new ResolverSettings(null, List.of(Tier.TIER1, Tier.TIER1, Tier.EMERGENCY), null),
            0);

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
            () -> StartupConfigValidator.validate(bad, ReentryVocabulary.defaults()));

        List<String> problems = e.getProblems();
        assertEquals(10, problems.size(), problems.toString());
        assertTrue(problems.stream().anyMatch(p -> p.contains("profitThresholdPips")));
        assertTrue(problems.stream().anyMatch(p -> p.contains("ascending")));
        assertTrue(problems.stream().anyMatch(p -> p.contains("maxAttemptsPerDay")));
        assertTrue(problems.stream().anyMatch(p -> p.contains("lotSteps.XAUUSD")));
        assertTrue(problems.stream().anyMatch(p -> p.contains("EMERGENCY")));
        assertTrue(problems.stream().anyMatch(p -> p.contains("TIER1 twice")));
        assertTrue(problems.stream().anyMatch(p -> p.contains("workerThreads")));
    }

    @Test
    @DisplayName("Strong thresholds must sit beyond the plain ones and have tokens")
    void testStrongThresholds() {
        VocabularyDefinition d = VocabularyDefinition.defaults();
        ReentryVocabulary withoutStrong = new ReentryVocabulary(new VocabularyDefinition(
            d.durationBuckets(), d.proximityBuckets(),
            List.of(new OutcomeBucket("W1", 1, "Win"), new OutcomeBucket("BE", 0, "Break-even"),
                new OutcomeBucket("L1", -1, "Loss")),
            d.directionEnum(), d.generationRange(), d.strengthRange(), d.calendarPatterns(), d.calendarMinLength()));

        ReentrySettings strong = settings(null, null, null, new OutcomeMappingSettings(40.0, -40.0), null, null);
        InvalidConfigurationException missingTokens = assertThrows(InvalidConfigurationException.class,
            () -> StartupConfigValidator.validate(strong, withoutStrong));
        assertEquals(2, missingTokens.getProblems().size());

        ReentrySettings inverted = settings(null, null, null, new OutcomeMappingSettings(2.0, -2.0), null, null);
        InvalidConfigurationException tooWeak = assertThrows(InvalidConfigurationException.class,
            () -> StartupConfigValidator.validate(inverted, ReentryVocabulary.defaults()));
        assertEquals(2, tooWeak.getProblems().size());
    }
}
