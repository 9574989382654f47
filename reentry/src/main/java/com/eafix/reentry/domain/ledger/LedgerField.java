package com.eafix.reentry.domain.ledger;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * One ledger column: name, type and an optional value constraint.
 *
 * @param optional   an empty cell is accepted
 * @param constraint applied after the type check, only to non-empty cells
 * @param rule       human-readable form of the constraint, for violation messages
 */
public record LedgerField(
    String name,
    FieldType type,
    boolean optional,
    Predicate<String> constraint,
    String rule
) {
    public static LedgerField of(String name, FieldType type) {
        return new LedgerField(name, type, false, v -> true, null);
    }

    public static LedgerField text(String name) {
        return of(name, FieldType.TEXT);
    }

    public static LedgerField text(String name, int minLength, int maxLength) {
        return new LedgerField(name, FieldType.TEXT, false,
            v -> v.length() >= minLength && v.length() <= maxLength,
            "length " + minLength + ".." + maxLength);
    }

    public static LedgerField oneOf(String name, String... values) {
        Set<String> allowed = new LinkedHashSet<>(Arrays.asList(values));
        return new LedgerField(name, FieldType.TEXT, false, allowed::contains, "one of " + allowed);
    }

    public static LedgerField positive(String name) {
        return new LedgerField(name, FieldType.DECIMAL, false, v -> Double.parseDouble(v) > 0, "> 0");
    }

    public static LedgerField decimalRange(String name, double min, double max) {
        return new LedgerField(name, FieldType.DECIMAL, false,
            v -> {
                double d = Double.parseDouble(v);
                return d >= min && d <= max;
            },
            "within [" + min + ", " + max + "]");
    }

    public static LedgerField count(String name) {
        return new LedgerField(name, FieldType.INTEGER, false, v -> Long.parseLong(v) >= 0, ">= 0");
    }

    public LedgerField asOptional() {
        return new LedgerField(name, type, true, constraint, rule);
    }

    /**
     * @return a problem description, or empty if the value is acceptable
     */
    public Optional<String> check(String raw) {
        if (raw == null || raw.isEmpty()) {
            return optional ? Optional.empty() : Optional.of(name + " is required");
        }
        if (!type.parses(raw)) {
            return Optional.of(name + " '" + raw + "' is not a valid " + type.name().toLowerCase(Locale.ROOT));
        }
        if (!constraint.test(raw)) {
            return Optional.of(name + " '" + raw + "' violates " + rule);
        }
        return Optional.empty();
    }
}
