package com.eafix.reentry.bootstrap;

import com.eafix.reentry.config.ReentrySettings;
import com.eafix.reentry.config.ReentrySettings.ClassificationSettings;
import com.eafix.reentry.config.ReentrySettings.EligibilitySettings;
import com.eafix.reentry.config.ReentrySettings.OutcomeMappingSettings;
import com.eafix.reentry.config.ReentrySettings.SizingSettings;
import com.eafix.reentry.domain.common.InvalidConfigurationException;
import com.eafix.reentry.domain.decision.DurationClass;
import com.eafix.reentry.domain.hybrid.ChainPosition;
import com.eafix.reentry.domain.resolver.Tier;
import com.eafix.reentry.domain.vocab.Dimension;
import com.eafix.reentry.domain.vocab.ReentryVocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Startup configuration validator.
 *
 * Validates settings against each other and against the vocabulary before any
 * component is created. Collects every problem and throws once; the system refuses
 * to start on invalid configuration.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws InvalidConfigurationException listing every problem found
     */
    public static void validate(ReentrySettings settings, ReentryVocabulary vocabulary) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        List<String> problems = new ArrayList<>();
        checkClassification(settings.classification(), problems);
        checkEligibility(settings.eligibility(), problems);
        checkSizing(settings.sizing(), problems);
        checkOutcomeMapping(settings.outcomeMapping(), settings.classification(), vocabulary, problems);
        checkVocabulary(vocabulary, problems);
        checkHierarchy(settings.resolver().tierHierarchy(), problems);
        if (settings.workerThreads() < 1) {
            problems.add("workerThreads must be >= 1, got " + settings.workerThreads());
        }
        if (settings.recentDecisionLimit() < 0) {
            problems.add("recentDecisionLimit must be >= 0, got " + settings.recentDecisionLimit());
        }

        if (!problems.isEmpty()) {
            problems.forEach(p -> log.error("❌ {}", p));
            throw new InvalidConfigurationException(
                "Startup config validation failed with " + problems.size() + " problem(s)", problems);
        }
        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void checkClassification(ClassificationSettings c, List<String> problems) {
        if (c.profitThresholdPips() <= c.lossThresholdPips()) {
            problems.add("classification.profitThresholdPips (" + c.profitThresholdPips()
                + ") must be above lossThresholdPips (" + c.lossThresholdPips() + ")");
        }
        if (c.flashMaxMinutes() <= 0
            || c.quickMaxMinutes() <= c.flashMaxMinutes()
            || c.longMaxMinutes() <= c.quickMaxMinutes()) {
            problems.add("classification duration limits must be positive and ascending: flash="
                + c.flashMaxMinutes() + " quick=" + c.quickMaxMinutes() + " long=" + c.longMaxMinutes());
        }
    }

    private static void checkEligibility(EligibilitySettings e, List<String> problems) {
        if (e.minTradeDurationMinutes() < 0) {
            problems.add("eligibility.minTradeDurationMinutes must be >= 0");
        }
        if (e.cooldownMinutes() < 0) {
            problems.add("eligibility.cooldownMinutes must be >= 0");
        }
        if (e.maxAttemptsPerDay() < 1) {
            problems.add("eligibility.maxAttemptsPerDay must be >= 1");
        }
    }

    private static void checkSizing(SizingSettings s, List<String> problems) {
        if (s.defaultLotStep().signum() <= 0) {
            problems.add("sizing.defaultLotStep must be positive");
        }
        for (Map.Entry<String, BigDecimal> step : s.lotSteps().entrySet()) {
            if (step.getValue() == null || step.getValue().signum() <= 0) {
                problems.add("sizing.lotSteps." + step.getKey() + " must be positive");
            }
        }
    }

    private static void checkOutcomeMapping(OutcomeMappingSettings m, ClassificationSettings c,
                                            ReentryVocabulary vocabulary, List<String> problems) {
        Set<String> outcomes = vocabulary.legalTokens(Dimension.OUTCOME);
        if (m.strongWinThresholdPips() == null || m.strongLossThresholdPips() == null) {
            log.warn("⚠️  Strong outcome thresholds not fully configured (win={}, loss={}); "
                + "W2/L2 tokens will not be produced for the missing side",
                m.strongWinThresholdPips(), m.strongLossThresholdPips());
        }
        if (m.strongWinThresholdPips() != null) {
            if (m.strongWinThresholdPips() < c.profitThresholdPips()) {
                problems.add("outcomeMapping.strongWinThresholdPips must be >= profitThresholdPips");
            }
            if (!outcomes.contains("W2")) {
                problems.add("outcomeMapping.strongWinThresholdPips is set but the vocabulary has no W2 token");
            }
        }
        if (m.strongLossThresholdPips() != null) {
            if (m.strongLossThresholdPips() > c.lossThresholdPips()) {
                problems.add("outcomeMapping.strongLossThresholdPips must be <= lossThresholdPips");
            }
            if (!outcomes.contains("L2")) {
                problems.add("outcomeMapping.strongLossThresholdPips is set but the vocabulary has no L2 token");
            }
        }
    }

    private static void checkVocabulary(ReentryVocabulary vocabulary, List<String> problems) {
        for (String token : List.of("W1", "L1", "BE")) {
            if (!vocabulary.isValidOutcome(token)) {
                problems.add("vocabulary has no outcome token " + token);
            }
        }
        for (DurationClass duration : DurationClass.values()) {
            if (!vocabulary.isValidDuration(duration.name())) {
                problems.add("vocabulary has no duration token " + duration.name());
            }
        }
        ReentryVocabulary.GenerationRange range = vocabulary.generationRange();
        for (int g = range.min(); g <= range.max(); g++) {
            if (ChainPosition.forGeneration(g).isEmpty()) {
                problems.add("vocabulary generation " + g + " has no chain position");
            }
        }
    }

    private static void checkHierarchy(List<Tier> hierarchy, List<String> problems) {
        if (hierarchy.isEmpty()) {
            problems.add("resolver.tierHierarchy must not be empty");
            return;
        }
        Set<Tier> seen = new HashSet<>();
        for (Tier tier : hierarchy) {
            if (tier == Tier.EMERGENCY) {
                problems.add("resolver.tierHierarchy must not contain EMERGENCY");
            } else if (!seen.add(tier)) {
                problems.add("resolver.tierHierarchy lists " + tier + " twice");
            }
        }
        if (!seen.contains(Tier.GLOBAL)) {
            log.warn("⚠️  Tier hierarchy {} has no GLOBAL tier; unmatched contexts fall back to EMERGENCY", hierarchy);
        }
    }

    private StartupConfigValidator() {
        // Utility class - no instantiation
    }
}
