package com.eafix.reentry.domain.resolver;

import com.eafix.reentry.domain.decision.OutcomeClass;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A named, tiered re-entry rule.
 *
 * Predicates that are null match anything. Calendar and symbol predicates are
 * wildcard patterns ({@code *}, {@code X*}, {@code *X} or exact).
 *
 * Field names follow the shared {@code parameter_sets.json} format.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParameterSet(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("tier") Tier tier,

    // Matching criteria
    @JsonProperty("outcome_class") OutcomeClass outcomeClass,
    @JsonProperty("duration_class") String durationClass,
    @JsonProperty("proximity_state") String proximityState,
    @JsonProperty("calendar_pattern") String calendarPattern,
    @JsonProperty("symbol_pattern") String symbolPattern,

    // Re-entry parameters
    @JsonProperty("reentry_enabled") Boolean reentryEnabled,
    @JsonProperty("max_generation") Integer maxGeneration,
    @JsonProperty("lot_size_multiplier") Double lotSizeMultiplier,
    @JsonProperty("stop_loss_pips") Double stopLossPips,
    @JsonProperty("take_profit_pips") Double takeProfitPips,
    @JsonProperty("confidence_threshold") Double confidenceThreshold,

    // Timing
    @JsonProperty("min_wait_minutes") Integer minWaitMinutes,
    @JsonProperty("max_wait_minutes") Integer maxWaitMinutes,

    // Market condition filters, carried through but not evaluated here
    @JsonProperty("volatility_threshold") Double volatilityThreshold,
    @JsonProperty("spread_threshold") Double spreadThreshold,

    // Metadata
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    @JsonProperty("active") Boolean active
) {
    public ParameterSet {
        if (reentryEnabled == null) reentryEnabled = true;
        if (maxGeneration == null) maxGeneration = 3;
        if (lotSizeMultiplier == null) lotSizeMultiplier = 1.0;
        if (stopLossPips == null) stopLossPips = 20.0;
        if (takeProfitPips == null) takeProfitPips = 40.0;
        if (confidenceThreshold == null) confidenceThreshold = 0.6;
        if (minWaitMinutes == null) minWaitMinutes = 0;
        if (maxWaitMinutes == null) maxWaitMinutes = 60;
        if (active == null) active = true;
    }

    public static Builder builder(String id, Tier tier) {
        return new Builder(id, tier);
    }

    /**
     * Builder for parameter sets defined in code (built-in defaults, tests).
     */
    public static class Builder {
        private final String id;
        private final Tier tier;
        private String name;
        private OutcomeClass outcomeClass;
        private String durationClass;
        private String proximityState;
        private String calendarPattern;
        private String symbolPattern;
        private Boolean reentryEnabled;
        private Integer maxGeneration;
        private Double lotSizeMultiplier;
        private Double stopLossPips;
        private Double takeProfitPips;
        private Double confidenceThreshold;
        private Integer minWaitMinutes;
        private Integer maxWaitMinutes;
        private Double volatilityThreshold;
        private Double spreadThreshold;
        private Instant createdAt;
        private Instant updatedAt;
        private Boolean active;

        private Builder(String id, Tier tier) {
            this.id = id;
            this.tier = tier;
            this.name = id;
        }

        public Builder name(String name) { this.name = name; return this; }
        public Builder outcomeClass(OutcomeClass outcomeClass) { this.outcomeClass = outcomeClass; return this; }
        public Builder durationClass(String durationClass) { this.durationClass = durationClass; return this; }
        public Builder proximityState(String proximityState) { this.proximityState = proximityState; return this; }
        public Builder calendarPattern(String calendarPattern) { this.calendarPattern = calendarPattern; return this; }
        public Builder symbolPattern(String symbolPattern) { this.symbolPattern = symbolPattern; return this; }
        public Builder reentryEnabled(boolean reentryEnabled) { this.reentryEnabled = reentryEnabled; return this; }
        public Builder maxGeneration(int maxGeneration) { this.maxGeneration = maxGeneration; return this; }
        public Builder lotSizeMultiplier(double lotSizeMultiplier) { this.lotSizeMultiplier = lotSizeMultiplier; return this; }
        public Builder stopLossPips(double stopLossPips) { this.stopLossPips = stopLossPips; return this; }
        public Builder takeProfitPips(double takeProfitPips) { this.takeProfitPips = takeProfitPips; return this; }
        public Builder confidenceThreshold(double confidenceThreshold) { this.confidenceThreshold = confidenceThreshold; return this; }
        public Builder minWaitMinutes(int minWaitMinutes) { this.minWaitMinutes = minWaitMinutes; return this; }
        public Builder maxWaitMinutes(int maxWaitMinutes) { this.maxWaitMinutes = maxWaitMinutes; return this; }
        public Builder volatilityThreshold(Double volatilityThreshold) { this.volatilityThreshold = volatilityThreshold; return this; }
        public Builder spreadThreshold(Double spreadThreshold) { this.spreadThreshold = spreadThreshold; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }
        public Builder active(boolean active) { this.active = active; return this; }

        public ParameterSet build() {
            return new ParameterSet(id, name, tier, outcomeClass, durationClass, proximityState,
                calendarPattern, symbolPattern, reentryEnabled, maxGeneration, lotSizeMultiplier,
                stopLossPips, takeProfitPips, confidenceThreshold, minWaitMinutes, maxWaitMinutes,
                volatilityThreshold, spreadThreshold, createdAt, updatedAt, active);
        }
    }
}
