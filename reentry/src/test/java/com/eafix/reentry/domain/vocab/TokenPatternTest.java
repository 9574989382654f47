package com.eafix.reentry.domain.vocab;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Token Pattern Tests")
class TokenPatternTest {

    @Test
    @DisplayName("Supported pattern forms are valid")
    void testValidPatterns() {
        assertTrue(TokenPattern.isValid("*"));
        assertTrue(TokenPattern.isValid("CAL8_*"));
        assertTrue(TokenPattern.isValid("*USD"));
        assertTrue(TokenPattern.isValid("EURUSD"));
    }

    @Test
    @DisplayName("Other wildcard placements are rejected")
    void testInvalidPatterns() {
        assertFalse(TokenPattern.isValid(null));
        assertFalse(TokenPattern.isValid(""));
        assertFalse(TokenPattern.isValid("**"));
        assertFalse(TokenPattern.isValid("EUR*USD"));
        assertFalse(TokenPattern.isValid("*USD*"));
    }

    @Test
    @DisplayName("Prefix, suffix and exact matching")
    void testMatching() {
        assertTrue(TokenPattern.matches("CAL8_USD_NFP_H", "CAL8_*"));
        assertFalse(TokenPattern.matches("CAL5_USD_NFP_H", "CAL8_*"));
        assertTrue(TokenPattern.matches("EURUSD", "*USD"));
        assertFalse(TokenPattern.matches("USDJPY", "*USD"));
        assertTrue(TokenPattern.matches("EURUSD", "EURUSD"));
        assertFalse(TokenPattern.matches("EURUSD.", "EURUSD"));
    }

    @Test
    @DisplayName("Null and star patterns match anything, null values match only wildcards")
    void testWildcards() {
        assertTrue(TokenPattern.isWildcard(null));
        assertTrue(TokenPattern.isWildcard("*"));
        assertTrue(TokenPattern.matches(null, "*"));
        assertTrue(TokenPattern.matches("anything", null));
        assertFalse(TokenPattern.matches(null, "EURUSD"));
    }
}
