package com.eafix.reentry.config;

import com.eafix.reentry.domain.resolver.Tier;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Complete configuration of the re-entry core.
 *
 * Every option has a default; an absent key or section takes it. Unknown keys are
 * rejected by {@link SettingsLoader}.
 */
public record ReentrySettings(
    @JsonProperty("classification")
    ClassificationSettings classification,

    @JsonProperty("eligibility")
    EligibilitySettings eligibility,

    @JsonProperty("sizing")
    SizingSettings sizing,

    @JsonProperty("outcomeMapping")
    OutcomeMappingSettings outcomeMapping,

    @JsonProperty("resolver")
    ResolverSettings resolver,

    @JsonProperty("ledger")
    LedgerSettings ledger,

    @JsonProperty("vocabularyFile")
    String vocabularyFile,          // null = built-in vocabulary

    @JsonProperty("workerThreads")
    Integer workerThreads,          // decision executor pool size

    @JsonProperty("recentDecisionLimit")
    Integer recentDecisionLimit     // decisions kept in memory for status
) {
    public ReentrySettings {
        if (classification == null) classification = ClassificationSettings.defaults();
        if (eligibility == null) eligibility = EligibilitySettings.defaults();
        if (sizing == null) sizing = SizingSettings.defaults();
        if (outcomeMapping == null) outcomeMapping = OutcomeMappingSettings.defaults();
        if (resolver == null) resolver = ResolverSettings.defaults();
        if (ledger == null) ledger = LedgerSettings.defaults();
        if (workerThreads == null) workerThreads = 4;
        if (recentDecisionLimit == null) recentDecisionLimit = 100;
    }

    public static ReentrySettings defaults() {
        return new ReentrySettings(null, null, null, null, null, null, null, null, null);
    }

    public ReentrySettings withLedger(LedgerSettings newLedger) {
        return new ReentrySettings(classification, eligibility, sizing, outcomeMapping, resolver, newLedger,
            vocabularyFile, workerThreads, recentDecisionLimit);
    }

    public ReentrySettings withResolver(ResolverSettings newResolver) {
        return new ReentrySettings(classification, eligibility, sizing, outcomeMapping, newResolver, ledger,
            vocabularyFile, workerThreads, recentDecisionLimit);
    }

    public ReentrySettings withEligibility(EligibilitySettings newEligibility) {
        return new ReentrySettings(classification, newEligibility, sizing, outcomeMapping, resolver, ledger,
            vocabularyFile, workerThreads, recentDecisionLimit);
    }

    /**
     * Outcome and duration classification of a closed trade.
     */
    public record ClassificationSettings(
        @JsonProperty("profitThresholdPips")
        Double profitThresholdPips,     // WIN at or above

        @JsonProperty("lossThresholdPips")
        Double lossThresholdPips,       // LOSS at or below

        @JsonProperty("flashMaxMinutes")
        Integer flashMaxMinutes,

        @JsonProperty("quickMaxMinutes")
        Integer quickMaxMinutes,

        @JsonProperty("longMaxMinutes")
        Integer longMaxMinutes          // above this is EXTENDED
    ) {
        public ClassificationSettings {
            if (profitThresholdPips == null) profitThresholdPips = 5.0;
            if (lossThresholdPips == null) lossThresholdPips = -5.0;
            if (flashMaxMinutes == null) flashMaxMinutes = 5;
            if (quickMaxMinutes == null) quickMaxMinutes = 30;
            if (longMaxMinutes == null) longMaxMinutes = 240;
        }

        public static ClassificationSettings defaults() {
            return new ClassificationSettings(null, null, null, null, null);
        }
    }

    /**
     * Which closed trades are considered for re-entry at all.
     */
    public record EligibilitySettings(
        @JsonProperty("onlyCompletedTrades")
        Boolean onlyCompletedTrades,

        @JsonProperty("minTradeDurationMinutes")
        Double minTradeDurationMinutes,

        @JsonProperty("excludeManualCloses")
        Boolean excludeManualCloses,

        @JsonProperty("cooldownMinutes")
        Integer cooldownMinutes,        // per symbol, from the last decision

        @JsonProperty("maxAttemptsPerDay")
        Integer maxAttemptsPerDay       // per symbol, R1/R2 decisions per UTC day
    ) {
        public EligibilitySettings {
            if (onlyCompletedTrades == null) onlyCompletedTrades = true;
            if (minTradeDurationMinutes == null) minTradeDurationMinutes = 1.0;
            if (excludeManualCloses == null) excludeManualCloses = false;
            if (cooldownMinutes == null) cooldownMinutes = 15;
            if (maxAttemptsPerDay == null) maxAttemptsPerDay = 5;
        }

        public static EligibilitySettings defaults() {
            return new EligibilitySettings(null, null, null, null, null);
        }
    }

    /**
     * Lot rounding. A symbol without its own step uses the default step.
     */
    public record SizingSettings(
        @JsonProperty("defaultLotStep")
        BigDecimal defaultLotStep,

        @JsonProperty("lotSteps")
        Map<String, BigDecimal> lotSteps
    ) {
        public SizingSettings {
            if (defaultLotStep == null) defaultLotStep = new BigDecimal("0.01");
            lotSteps = lotSteps != null ? Map.copyOf(lotSteps) : Map.of();
        }

        public static SizingSettings defaults() {
            return new SizingSettings(null, null);
        }
    }

    /**
     * Pip thresholds for the strong outcome tokens W2 and L2. Unset means those tokens
     * are never produced.
     */
    public record OutcomeMappingSettings(
        @JsonProperty("strongWinThresholdPips")
        Double strongWinThresholdPips,

        @JsonProperty("strongLossThresholdPips")
        Double strongLossThresholdPips
    ) {
        public static OutcomeMappingSettings defaults() {
            return new OutcomeMappingSettings(null, null);
        }
    }

    public record ResolverSettings(
        @JsonProperty("parameterFile")
        String parameterFile,

        @JsonProperty("tierHierarchy")
        List<Tier> tierHierarchy,

        @JsonProperty("writeDefaultsWhenMissing")
        Boolean writeDefaultsWhenMissing
    ) {
        public ResolverSettings {
            if (parameterFile == null) parameterFile = "config/parameter_sets.json";
            tierHierarchy = tierHierarchy != null ? List.copyOf(tierHierarchy) : Tier.defaultHierarchy();
            if (writeDefaultsWhenMissing == null) writeDefaultsWhenMissing = false;
        }

        public static ResolverSettings defaults() {
            return new ResolverSettings(null, null, null);
        }
    }

    public record LedgerSettings(
        @JsonProperty("directory")
        String directory,

        @JsonProperty("resumeSequence")
        Boolean resumeSequence          // continue after the highest file_seq on disk
    ) {
        public LedgerSettings {
            if (directory == null) directory = "data/csv";
            if (resumeSequence == null) resumeSequence = true;
        }

        public static LedgerSettings defaults() {
            return new LedgerSettings(null, null);
        }
    }
}
