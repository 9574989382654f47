package com.eafix.reentry.infrastructure.ledger;

import com.eafix.reentry.domain.decision.ReentryDecisionRecord;
import com.eafix.reentry.domain.ledger.FieldType;
import com.eafix.reentry.domain.ledger.LedgerField;
import com.eafix.reentry.domain.ledger.LedgerSchema;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Known ledger record types, keyed by record type (the filename prefix).
 *
 * Besides the decisions this core writes, the defaults cover the files produced by
 * the sibling ingestion services so one validator can check the whole exchange directory.
 */
public final class SchemaRegistry {

    public static final LedgerSchema ACTIVE_CALENDAR_SIGNALS = LedgerSchema.of("active_calendar_signals",
        LedgerField.text("calendar_id"),
        LedgerField.text("symbol", 6, 8),
        LedgerField.oneOf("impact_level", "HIGH", "MEDIUM", "LOW"),
        LedgerField.oneOf("proximity_state", "IMMEDIATE", "NEAR", "FAR"),
        LedgerField.of("anticipation_event", FieldType.BOOLEAN),
        LedgerField.oneOf("direction_bias", "BULLISH", "BEARISH", "NEUTRAL"),
        LedgerField.decimalRange("confidence_score", 0.0, 1.0)
    );

    public static final LedgerSchema TRADE_RESULTS = LedgerSchema.of("trade_results",
        LedgerField.text("trade_id"),
        LedgerField.text("symbol", 6, 8),
        LedgerField.oneOf("direction", "BUY", "SELL"),
        LedgerField.positive("lot_size"),
        LedgerField.positive("open_price"),
        LedgerField.positive("close_price"),
        LedgerField.of("open_time", FieldType.TIMESTAMP),
        LedgerField.of("close_time", FieldType.TIMESTAMP),
        LedgerField.count("duration_minutes"),
        LedgerField.of("profit_loss", FieldType.DECIMAL),
        LedgerField.of("profit_loss_pips", FieldType.DECIMAL),
        LedgerField.positive("stop_loss").asOptional(),
        LedgerField.positive("take_profit").asOptional(),
        LedgerField.oneOf("close_reason", "TP", "SL", "MANUAL", "TIMEOUT"),
        LedgerField.of("commission", FieldType.DECIMAL),
        LedgerField.of("swap", FieldType.DECIMAL),
        LedgerField.of("magic_number", FieldType.INTEGER),
        LedgerField.text("comment").asOptional()
    );

    public static final LedgerSchema HEALTH_METRICS = LedgerSchema.of("health_metrics",
        LedgerField.text("service_name"),
        LedgerField.text("metric_name"),
        LedgerField.of("metric_value", FieldType.DECIMAL),
        LedgerField.text("metric_unit"),
        LedgerField.oneOf("health_status", "HEALTHY", "DEGRADED", "UNHEALTHY"),
        LedgerField.decimalRange("cpu_usage_percent", 0.0, 100.0),
        LedgerField.decimalRange("memory_usage_percent", 0.0, 100.0),
        LedgerField.decimalRange("disk_usage_percent", 0.0, 100.0),
        LedgerField.count("active_connections"),
        LedgerField.count("messages_processed"),
        LedgerField.count("error_count"),
        LedgerField.count("uptime_seconds")
    );

    private final Map<String, LedgerSchema> schemas = new LinkedHashMap<>();

    public static SchemaRegistry defaults() {
        return new SchemaRegistry()
            .register(ReentryDecisionRecord.SCHEMA)
            .register(ACTIVE_CALENDAR_SIGNALS)
            .register(TRADE_RESULTS)
            .register(HEALTH_METRICS);
    }

    public SchemaRegistry register(LedgerSchema schema) {
        schemas.put(schema.recordType(), schema);
        return this;
    }

    /**
     * Schema whose record type is the longest prefix of the file name.
     */
    public Optional<LedgerSchema> detect(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return schemas.values().stream()
            .filter(s -> lower.startsWith(s.recordType() + "_"))
            .max(Comparator.comparingInt(s -> s.recordType().length()));
    }

    public Collection<LedgerSchema> all() {
        return Collections.unmodifiableCollection(schemas.values());
    }
}
