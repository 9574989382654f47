package com.eafix.reentry.domain.resolver;

/**
 * Outcome of one resolution: the winning parameter set's values plus how it was found.
 *
 * @param specificityScore    fraction of the five predicate fields the winning set constrained and matched
 * @param generationAllowed   whether the requested generation is within the set's max generation
 * @param nextGeneration      generation after the requested one, null at or above the max
 */
public record ResolvedParameters(
    String parameterSetId,
    String parameterSetName,
    Tier resolvedTier,
    double specificityScore,
    boolean reentryEnabled,
    int maxGeneration,
    double lotSizeMultiplier,
    double stopLossPips,
    double takeProfitPips,
    double confidenceThreshold,
    int minWaitMinutes,
    int maxWaitMinutes,
    Double volatilityThreshold,
    Double spreadThreshold,
    boolean generationAllowed,
    Integer nextGeneration
) {
    public static final String EMERGENCY_ID = "emergency_fallback";

    public static ResolvedParameters from(ParameterSet set, Tier tier, double specificity, int generation) {
        int max = set.maxGeneration();
        return new ResolvedParameters(
            set.id(),
            set.name(),
            tier,
            specificity,
            set.reentryEnabled(),
            max,
            set.lotSizeMultiplier(),
            set.stopLossPips(),
            set.takeProfitPips(),
            set.confidenceThreshold(),
            set.minWaitMinutes(),
            set.maxWaitMinutes(),
            set.volatilityThreshold(),
            set.spreadThreshold(),
            generation <= max,
            generation < max ? generation + 1 : null
        );
    }

    /**
     * Safe result when no tier matched: re-entry disabled, full confidence required.
     */
    public static ResolvedParameters emergency(int generation) {
        ParameterSet fallback = ParameterSet.builder(EMERGENCY_ID, Tier.EMERGENCY)
            .name("Emergency Fallback")
            .reentryEnabled(false)
            .confidenceThreshold(1.0)
            .build();
        return from(fallback, Tier.EMERGENCY, 0.0, generation);
    }

    public boolean isEmergency() {
        return resolvedTier == Tier.EMERGENCY;
    }
}
