package com.eafix.reentry.domain.decision;

import com.eafix.reentry.domain.hybrid.ChainPosition;
import com.eafix.reentry.domain.ledger.LedgerEntry;
import com.eafix.reentry.domain.ledger.LedgerField;
import com.eafix.reentry.domain.ledger.LedgerSchema;
import com.eafix.reentry.domain.resolver.Tier;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Durable output of one accepted decision, one row of a {@code reentry_decisions} file.
 */
public record ReentryDecisionRecord(
    String tradeId,
    String hybridId,
    String symbol,
    OutcomeClass outcomeClass,
    DurationClass durationClass,
    ReentryAction reentryAction,
    String parameterSetId,
    Tier resolvedTier,
    ChainPosition chainPosition,
    BigDecimal lotSize,
    double stopLoss,
    double takeProfit
) implements LedgerEntry {

    public static final String RECORD_TYPE = "reentry_decisions";

    public static final LedgerSchema SCHEMA = LedgerSchema.of(RECORD_TYPE,
        LedgerField.text("trade_id"),
        LedgerField.text("hybrid_id"),
        LedgerField.text("symbol", 6, 8),
        LedgerField.oneOf("outcome_class", "WIN", "LOSS", "BREAKEVEN"),
        LedgerField.oneOf("duration_class", "FLASH", "QUICK", "LONG", "EXTENDED"),
        LedgerField.oneOf("reentry_action", "R1", "R2", "HOLD", "NO_REENTRY"),
        LedgerField.text("parameter_set_id"),
        LedgerField.oneOf("resolved_tier", "EXACT", "TIER1", "TIER2", "TIER3", "GLOBAL", "EMERGENCY"),
        LedgerField.oneOf("chain_position", "O", "R1", "R2"),
        LedgerField.positive("lot_size"),
        LedgerField.positive("stop_loss"),
        LedgerField.positive("take_profit")
    );

    @Override
    public LedgerSchema schema() {
        return SCHEMA;
    }

    @Override
    public Map<String, String> values() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("trade_id", tradeId);
        values.put("hybrid_id", hybridId);
        values.put("symbol", symbol);
        values.put("outcome_class", outcomeClass.name());
        values.put("duration_class", durationClass.name());
        values.put("reentry_action", reentryAction.name());
        values.put("parameter_set_id", parameterSetId);
        values.put("resolved_tier", resolvedTier.name());
        values.put("chain_position", chainPosition.name());
        values.put("lot_size", lotSize.toPlainString());
        values.put("stop_loss", BigDecimal.valueOf(stopLoss).toPlainString());
        values.put("take_profit", BigDecimal.valueOf(takeProfit).toPlainString());
        return values;
    }
}
