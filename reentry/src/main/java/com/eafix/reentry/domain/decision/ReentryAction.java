package com.eafix.reentry.domain.decision;

/**
 * What the EA should do after a decision.
 */
public enum ReentryAction {
    /** Re-enter as generation 2 */
    R1,
    /** Re-enter as generation 3 */
    R2,
    /** Re-entry allowed but the next generation has no chain label */
    HOLD,
    NO_REENTRY;

    public boolean isReentry() {
        return this == R1 || this == R2;
    }
}
