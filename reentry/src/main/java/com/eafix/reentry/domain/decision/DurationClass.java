package com.eafix.reentry.domain.decision;

/**
 * Classification of how long a trade was open. EXTENDED is anything above the LONG limit.
 */
public enum DurationClass {
    FLASH,
    QUICK,
    LONG,
    EXTENDED
}
