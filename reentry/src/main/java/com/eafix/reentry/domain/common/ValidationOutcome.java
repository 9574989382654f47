package com.eafix.reentry.domain.common;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a validation that reports problems instead of throwing.
 *
 * Callers decide whether a failed outcome is a rejection or only a warning.
 */
public record ValidationOutcome(
    boolean valid,
    List<String> reasons
) {
    public ValidationOutcome {
        reasons = List.copyOf(reasons);
    }

    public static ValidationOutcome ok() {
        return new ValidationOutcome(true, List.of());
    }

    public static ValidationOutcome failed(List<String> reasons) {
        return new ValidationOutcome(false, reasons);
    }

    /**
     * Reasons joined for log lines and exception messages.
     */
    public String describe() {
        return String.join("; ", reasons);
    }

    /**
     * Builder for accumulating reasons.
     */
    public static class Builder {
        private final List<String> reasons = new ArrayList<>();

        public Builder check(boolean condition, String reason) {
            if (!condition) {
                reasons.add(reason);
            }
            return this;
        }

        public ValidationOutcome build() {
            return reasons.isEmpty() ? ok() : failed(reasons);
        }
    }
}
