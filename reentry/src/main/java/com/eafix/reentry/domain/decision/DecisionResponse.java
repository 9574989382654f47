package com.eafix.reentry.domain.decision;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Result handed back to the caller of {@code process}.
 *
 * Either an accepted decision (recorded in the ledger) or a skip with its reason;
 * fields that do not apply are null and omitted from JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DecisionResponse(
    @JsonProperty("status") String status,
    @JsonProperty("reason") String reason,
    @JsonProperty("trade_id") String tradeId,
    @JsonProperty("identifier") String identifier,
    @JsonProperty("comment_suffix") String commentSuffix,
    @JsonProperty("outcome_class") OutcomeClass outcomeClass,
    @JsonProperty("duration_class") DurationClass durationClass,
    @JsonProperty("reentry_action") ReentryAction reentryAction,
    @JsonProperty("parameter_set_id") String parameterSetId,
    @JsonProperty("resolved_tier") String resolvedTier,
    @JsonProperty("chain_position") String chainPosition,
    @JsonProperty("lot_size") BigDecimal lotSize,
    @JsonProperty("stop_loss") Double stopLoss,
    @JsonProperty("take_profit") Double takeProfit,
    @JsonProperty("confidence_score") Double confidenceScore,
    @JsonProperty("file_seq") Long fileSeq,
    @JsonProperty("checksum_sha256") String checksumSha256
) {
    public static final String STATUS_ACCEPTED = "accepted";
    public static final String STATUS_SKIPPED = "skipped";

    public static DecisionResponse skipped(String tradeId, SkipReason reason) {
        return new DecisionResponse(STATUS_SKIPPED, reason.reason(), tradeId, null, null, null, null, null,
            null, null, null, null, null, null, null, null, null);
    }

    @JsonIgnore
    public boolean isSkipped() {
        return STATUS_SKIPPED.equals(status);
    }
}
