package com.eafix.reentry.domain.decision;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Input for one decision: a closed (or closing) trade and its market context.
 *
 * Outcome and duration classes are not supplied; the processor derives them from
 * {@code profitLossPips} and {@code durationMinutes}. Fields are boxed so a missing
 * value in a request is reported instead of silently becoming zero.
 */
public record DecisionContext(
    @JsonProperty("trade_id") String tradeId,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("direction") String direction,
    @JsonProperty("proximity_state") String proximityState,
    @JsonProperty("calendar_id") String calendarId,
    @JsonProperty("generation") Integer generation,          // current, before re-entry
    @JsonProperty("current_lot_size") BigDecimal currentLotSize,
    @JsonProperty("profit_loss_pips") Double profitLossPips,
    @JsonProperty("duration_minutes") Double durationMinutes,
    @JsonProperty("close_time") Instant closeTime,           // null while the trade is open
    @JsonProperty("close_reason") String closeReason         // TP, SL, MANUAL, TIMEOUT; optional
) {
    public static final String MANUAL_CLOSE = "MANUAL";

    @JsonIgnore
    public boolean isClosed() {
        return closeTime != null;
    }

    @JsonIgnore
    public boolean isManualClose() {
        return MANUAL_CLOSE.equalsIgnoreCase(closeReason);
    }
}
