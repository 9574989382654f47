package com.eafix.reentry.domain.ledger;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Value types a ledger column may hold, with the parse rule the validator applies.
 */
public enum FieldType {
    INTEGER {
        @Override
        public boolean parses(String raw) {
            try {
                Long.parseLong(raw);
                return true;
            } catch (NumberFormatException e) {
                return false;
            }
        }
    },
    DECIMAL {
        @Override
        public boolean parses(String raw) {
            try {
                return Double.isFinite(Double.parseDouble(raw));
            } catch (NumberFormatException e) {
                return false;
            }
        }
    },
    TEXT {
        @Override
        public boolean parses(String raw) {
            return true;
        }
    },
    BOOLEAN {
        @Override
        public boolean parses(String raw) {
            return BOOLEAN_TOKENS.contains(raw.toLowerCase(Locale.ROOT));
        }
    },
    /** ISO-8601 instant, offset date-time or local date-time (read as UTC) */
    TIMESTAMP {
        @Override
        public boolean parses(String raw) {
            return parseTimestamp(raw) != null;
        }
    },
    /** 64 lowercase hex characters */
    CHECKSUM {
        @Override
        public boolean parses(String raw) {
            return CHECKSUM_PATTERN.matcher(raw).matches();
        }
    };

    private static final Set<String> BOOLEAN_TOKENS = Set.of("true", "false", "1", "0", "yes", "no");
    private static final Pattern CHECKSUM_PATTERN = Pattern.compile("^[a-f0-9]{64}$");

    public abstract boolean parses(String raw);

    /**
     * @return the parsed instant, or null if the text is not a supported timestamp form
     */
    public static Instant parseTimestamp(String raw) {
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(raw, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
