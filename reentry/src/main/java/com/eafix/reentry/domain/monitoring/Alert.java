package com.eafix.reentry.domain.monitoring;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator-facing alarm raised by a core component.
 *
 * @param alertType one of the type constants below
 * @param details   extra context, copied and unmodifiable
 */
public record Alert(
    String alertType,
    AlertLevel level,
    String component,
    String message,
    Instant raisedAt,
    Map<String, Object> details
) {
    /** No parameter set matched; the decision used EMERGENCY parameters. */
    public static final String RESOLVER_EXHAUSTED = "RESOLVER_EXHAUSTED";
    public static final String LEDGER_WRITE_FAILURE = "LEDGER_WRITE_FAILURE";
    public static final String PARAMETER_RELOAD_REJECTED = "PARAMETER_RELOAD_REJECTED";

    public Alert {
        if (alertType == null || level == null || message == null) {
            throw new IllegalArgumentException("alertType, level and message are required");
        }
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String alertType;
        private AlertLevel level;
        private String component = "reentry";
        private String message;
        private Instant raisedAt;
        private final Map<String, Object> details = new LinkedHashMap<>();

        public Builder alertType(String alertType) { this.alertType = alertType; return this; }
        public Builder level(AlertLevel level) { this.level = level; return this; }
        public Builder component(String component) { this.component = component; return this; }
        public Builder message(String message) { this.message = message; return this; }
        public Builder raisedAt(Instant raisedAt) { this.raisedAt = raisedAt; return this; }

        public Builder detail(String key, Object value) {
            details.put(key, value);
            return this;
        }

        public Alert build() {
            return new Alert(alertType, level, component, message,
                raisedAt != null ? raisedAt : Instant.now(), details);
        }
    }

    @Override
    public String toString() {
        return "[" + level + "] " + component + "/" + alertType + ": " + message;
    }
}
