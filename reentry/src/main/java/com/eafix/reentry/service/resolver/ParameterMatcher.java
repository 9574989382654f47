package com.eafix.reentry.service.resolver;

import com.eafix.reentry.domain.decision.OutcomeClass;
import com.eafix.reentry.domain.resolver.ParameterSet;
import com.eafix.reentry.domain.vocab.TokenPattern;

import java.util.OptionalDouble;

/**
 * Predicate evaluation for a single parameter set.
 *
 * Specificity is the number of constrained predicate fields divided by the five
 * predicate fields, so a set constraining only the outcome scores 0.2 and a set
 * constraining all five scores 1.0. A {@code *} pattern constrains nothing.
 */
final class ParameterMatcher {
    static final int PREDICATE_FIELDS = 5;

    private ParameterMatcher() {}

    /**
     * @return specificity if the set is active and every constrained field matches, else empty
     */
    static OptionalDouble score(ParameterSet set, OutcomeClass outcome, String duration,
                                String proximity, String calendar, String symbol) {
        if (!set.active()) {
            return OptionalDouble.empty();
        }
        int matched = 0;

        if (set.outcomeClass() != null) {
            if (set.outcomeClass() != outcome) {
                return OptionalDouble.empty();
            }
            matched++;
        }
        if (set.durationClass() != null) {
            if (!set.durationClass().equals(duration)) {
                return OptionalDouble.empty();
            }
            matched++;
        }
        if (set.proximityState() != null) {
            if (!set.proximityState().equals(proximity)) {
                return OptionalDouble.empty();
            }
            matched++;
        }
        if (!TokenPattern.isWildcard(set.calendarPattern())) {
            if (!TokenPattern.matches(calendar, set.calendarPattern())) {
                return OptionalDouble.empty();
            }
            matched++;
        }
        if (!TokenPattern.isWildcard(set.symbolPattern())) {
            if (!TokenPattern.matches(symbol, set.symbolPattern())) {
                return OptionalDouble.empty();
            }
            matched++;
        }
        return OptionalDouble.of((double) matched / PREDICATE_FIELDS);
    }
}
