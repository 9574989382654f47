package com.eafix.reentry.domain.vocab;

/**
 * The six decision dimensions encoded in a hybrid ID, in identifier order.
 */
public enum Dimension {
    OUTCOME,
    DURATION,
    PROXIMITY,
    CALENDAR,
    DIRECTION,
    GENERATION
}
