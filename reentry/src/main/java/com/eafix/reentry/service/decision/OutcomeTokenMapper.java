package com.eafix.reentry.service.decision;

import com.eafix.reentry.config.ReentrySettings.OutcomeMappingSettings;
import com.eafix.reentry.domain.decision.OutcomeClass;

/**
 * Outcome class to hybrid ID outcome token.
 *
 * WIN maps to W1, LOSS to L1 and BREAKEVEN to BE. W2 and L2 are produced only when the
 * corresponding strong-outcome pip threshold is configured.
 */
public final class OutcomeTokenMapper {
    private final Double strongWinThresholdPips;
    private final Double strongLossThresholdPips;

    public OutcomeTokenMapper(OutcomeMappingSettings settings) {
        this.strongWinThresholdPips = settings.strongWinThresholdPips();
        this.strongLossThresholdPips = settings.strongLossThresholdPips();
    }

    public String token(OutcomeClass outcome, double profitLossPips) {
        switch (outcome) {
            case WIN:
                return strongWinThresholdPips != null && profitLossPips >= strongWinThresholdPips ? "W2" : "W1";
            case LOSS:
                return strongLossThresholdPips != null && profitLossPips <= strongLossThresholdPips ? "L2" : "L1";
            default:
                return "BE";
        }
    }

    /**
     * False while W2/L2 cannot be produced.
     */
    public boolean usesStrongTokens() {
        return strongWinThresholdPips != null || strongLossThresholdPips != null;
    }
}
