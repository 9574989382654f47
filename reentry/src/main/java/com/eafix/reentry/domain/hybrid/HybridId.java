package com.eafix.reentry.domain.hybrid;

import java.util.StringJoiner;

/**
 * Hybrid identifier: the six decision dimensions of one re-entry decision plus an
 * optional six character suffix.
 *
 * Instances are produced by {@code HybridIdCodec}, which guarantees every component is
 * legal in the vocabulary. The record itself does no validation.
 */
public record HybridId(
    String outcome,
    String duration,
    String proximity,
    String calendar,
    String direction,
    int generation,
    String suffix   // null when absent
) {
    public static final String DELIMITER = "_";

    public boolean hasSuffix() {
        return suffix != null;
    }

    public HybridId withSuffix(String newSuffix) {
        return new HybridId(outcome, duration, proximity, calendar, direction, generation, newSuffix);
    }

    public HybridId withoutSuffix() {
        return withSuffix(null);
    }

    /**
     * Canonical string form, components joined with {@value #DELIMITER}.
     */
    public String value() {
        StringJoiner joiner = new StringJoiner(DELIMITER);
        joiner.add(outcome).add(duration).add(proximity).add(calendar).add(direction)
            .add(Integer.toString(generation));
        if (suffix != null) {
            joiner.add(suffix);
        }
        return joiner.toString();
    }

    @Override
    public String toString() {
        return value();
    }
}
