package com.eafix.reentry.domain.decision;

/**
 * Why the eligibility gate declined to process a trade.
 */
public enum SkipReason {
    TRADE_NOT_COMPLETED("trade_not_completed"),
    DURATION_TOO_SHORT("duration_too_short"),
    MANUAL_CLOSE_EXCLUDED("manual_close_excluded"),
    COOLDOWN_PERIOD_ACTIVE("cooldown_period_active"),
    DAILY_LIMIT_EXCEEDED("daily_limit_exceeded");

    private final String reason;

    SkipReason(String reason) {
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
