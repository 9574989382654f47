package com.eafix.reentry.domain.decision;

/**
 * Coarse classification of a closed trade's result.
 */
public enum OutcomeClass {
    WIN,
    LOSS,
    BREAKEVEN
}
