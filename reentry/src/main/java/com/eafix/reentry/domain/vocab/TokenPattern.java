package com.eafix.reentry.domain.vocab;

/**
 * Wildcard pattern semantics shared by the vocabulary (calendar tokens) and the
 * parameter resolver (calendar and symbol predicates).
 *
 * Supported forms:
 * <pre>
 *   *        matches anything
 *   CAL8_*   prefix match
 *   *USD     suffix match
 *   EURUSD   exact match
 * </pre>
 *
 * Any other use of '*' (e.g. "**", "A*B", "*A*") is rejected by {@link #isValid(String)}.
 * Pure functions, thread-safe.
 */
public final class TokenPattern {

    public static final String WILDCARD = "*";

    private TokenPattern() {}

    /**
     * Check pattern syntax.
     *
     * @param pattern Pattern text
     * @return true if the pattern is one of the supported forms
     */
    public static boolean isValid(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return false;
        }
        if (WILDCARD.equals(pattern)) {
            return true;
        }
        int stars = countStars(pattern);
        if (stars == 0) {
            return true;
        }
        if (stars > 1) {
            return false;
        }
        return pattern.startsWith(WILDCARD) || pattern.endsWith(WILDCARD);
    }

    /**
     * A pattern that constrains nothing.
     */
    public static boolean isWildcard(String pattern) {
        return pattern == null || WILDCARD.equals(pattern);
    }

    /**
     * Match a value against a pattern.
     *
     * @param value Value to test (null never matches a non-wildcard pattern)
     * @param pattern Pattern, assumed valid
     * @return true on match
     */
    public static boolean matches(String value, String pattern) {
        if (isWildcard(pattern)) {
            return true;
        }
        if (value == null) {
            return false;
        }
        if (pattern.endsWith(WILDCARD)) {
            return value.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        if (pattern.startsWith(WILDCARD)) {
            return value.endsWith(pattern.substring(1));
        }
        return value.equals(pattern);
    }

    private static int countStars(String pattern) {
        int count = 0;
        for (int i = 0; i < pattern.length(); i++) {
            if (pattern.charAt(i) == '*') {
                count++;
            }
        }
        return count;
    }
}
