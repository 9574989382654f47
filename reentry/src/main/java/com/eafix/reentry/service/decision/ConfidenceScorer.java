package com.eafix.reentry.service.decision;

import com.eafix.reentry.domain.decision.OutcomeClass;

/**
 * Confidence of a decision in [0, 1].
 *
 * base threshold + 0.2 x specificity, +0.1 for a win, -0.1 for a loss,
 * -0.05 for each generation after the first. Rounded to four decimals.
 */
public final class ConfidenceScorer {
    static final double SPECIFICITY_WEIGHT = 0.2;
    static final double WIN_ADJUSTMENT = 0.1;
    static final double LOSS_ADJUSTMENT = -0.1;
    static final double GENERATION_PENALTY = 0.05;

    private ConfidenceScorer() {}

    public static double score(double confidenceThreshold, double specificity, OutcomeClass outcome, int generation) {
        double outcomeAdjustment = 0.0;
        if (outcome == OutcomeClass.WIN) {
            outcomeAdjustment = WIN_ADJUSTMENT;
        } else if (outcome == OutcomeClass.LOSS) {
            outcomeAdjustment = LOSS_ADJUSTMENT;
        }
        double confidence = confidenceThreshold
            + specificity * SPECIFICITY_WEIGHT
            + outcomeAdjustment
            - GENERATION_PENALTY * (generation - 1);
        double clamped = Math.max(0.0, Math.min(1.0, confidence));
        return Math.round(clamped * 10_000d) / 10_000d;
    }
}
