package com.eafix.reentry.service.codec;

import com.eafix.reentry.domain.hybrid.ChainPosition;
import com.eafix.reentry.domain.hybrid.HybridId;
import com.eafix.reentry.domain.hybrid.InvalidComponentException;
import com.eafix.reentry.domain.hybrid.InvalidGenerationException;
import com.eafix.reentry.domain.hybrid.InvalidSuffixException;
import com.eafix.reentry.domain.hybrid.MalformedIdentifierException;
import com.eafix.reentry.domain.vocab.Dimension;
import com.eafix.reentry.domain.vocab.ReentryVocabulary;
import com.eafix.reentry.infrastructure.metrics.ReentryMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for HybridIdCodec.
 *
 * Tests:
 * - Compose and parse of the canonical example
 * - Parse of every legal combination returns the composed components
 * - Comment hash shape, determinism and known values
 * - Rejections for illegal components, suffixes and malformed text
 * - Comment form of text that does not parse
 */
@DisplayName("Hybrid ID Codec Tests")
class HybridIdCodecTest {

    private static final String EXAMPLE = "W1_QUICK_AT_EVENT_CAL8_USD_NFP_H_LONG_1";

    private ReentryVocabulary vocabulary;
    private HybridIdCodec codec;

    @BeforeEach
    void setUp() {
        vocabulary = ReentryVocabulary.defaults();
        codec = new HybridIdCodec(vocabulary);
    }

    @Test
    @DisplayName("Compose produces the canonical string")
    void testComposeExample() {
        HybridId id = codec.compose("W1", "QUICK", "AT_EVENT", "CAL8_USD_NFP_H", "LONG", 1);
        assertEquals(EXAMPLE, id.value());
        assertFalse(id.hasSuffix());
    }

    @Test
    @DisplayName("Parse recovers every component of the canonical example")
    void testParseExample() {
        HybridId id = codec.parse(EXAMPLE);
        assertEquals("W1", id.outcome());
        assertEquals("QUICK", id.duration());
        assertEquals("AT_EVENT", id.proximity());
        assertEquals("CAL8_USD_NFP_H", id.calendar());
        assertEquals("LONG", id.direction());
        assertEquals(1, id.generation());
        assertNull(id.suffix());
        assertTrue(codec.validate(EXAMPLE));
    }

    @Test
    @DisplayName("Parse inverts compose for all legal token combinations")
    void testRoundTripAcrossVocabulary() {
        List<String> calendars = List.of("NONE", "CAL8_USD_NFP_H", "CAL5_EUR_CPI", "CAL8_3_2_1", "CAL8_USD_1_H");
        for (String outcome : vocabulary.legalTokens(Dimension.OUTCOME)) {
            for (String duration : vocabulary.legalTokens(Dimension.DURATION)) {
                for (String proximity : vocabulary.legalTokens(Dimension.PROXIMITY)) {
                    for (String calendar : calendars) {
                        for (String direction : vocabulary.legalTokens(Dimension.DIRECTION)) {
                            for (int generation = 1; generation <= 3; generation++) {
                                HybridId composed = codec.compose(outcome, duration, proximity, calendar,
                                    direction, generation);
                                assertEquals(composed, codec.parse(composed.value()), composed.value());
                                assertTrue(codec.validate(composed.value()), composed.value());
                            }
                        }
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("Calendars with empty segments cannot be composed")
    void testEmptyCalendarSegmentsRejected() {
        for (String calendar : List.of("CAL8__NFP", "CAL8_USD_", "CAL5_EUR__H")) {
            assertThrows(InvalidComponentException.class,
                () -> codec.compose("W1", "QUICK", "AT_EVENT", calendar, "LONG", 1), calendar);
            assertFalse(codec.validate("W1_QUICK_AT_EVENT_" + calendar + "_LONG_1"), calendar);
        }
    }

    @Test
    @DisplayName("Suffix is carried through compose and parse")
    void testSuffix() {
        HybridId id = codec.compose("L1", "LONG", "PRE_1H", "NONE", "SHORT", 2, "a1b2c3");
        assertEquals("L1_LONG_PRE_1H_NONE_SHORT_2_a1b2c3", id.value());
        assertEquals(id, codec.parse(id.value()));
        assertEquals("L1_LONG_PRE_1H_NONE_SHORT_2", id.withoutSuffix().value());
    }

    @Test
    @DisplayName("Comment hash matches known values")
    void testCommentHashGolden() {
        assertEquals("429f86", codec.commentHash(EXAMPLE));
        assertEquals("f991e2", codec.commentHash("W1_QUICK_AT_EVENT_NONE_LONG_1"));
        assertEquals("e3b0c4", codec.commentHash(""));
        assertTrue(codec.verifySuffixParity(EXAMPLE, "429f86"));
        assertFalse(codec.verifySuffixParity(EXAMPLE, "000000"));
    }

    @Test
    @DisplayName("Comment hash is deterministic and always 6 lowercase alphanumerics")
    void testCommentHashShape() {
        String longInput = "X".repeat(10_000);
        for (String input : List.of(EXAMPLE, "a", longInput, "ü€ unicode")) {
            String first = codec.commentHash(input);
            assertEquals(first, codec.commentHash(input));
            assertTrue(first.matches("^[a-z0-9]{6}$"), first);
        }
        HybridId id = codec.parse(EXAMPLE);
        assertEquals(codec.commentHash(EXAMPLE), codec.commentHash(id));
    }

    @Test
    @DisplayName("Illegal components are all reported")
    void testInvalidComponents() {
        InvalidComponentException e = assertThrows(InvalidComponentException.class,
            () -> codec.compose("W3", "QUICK", "AT_EVENT", "CAL9_XXX_YYY", "UP", 1));
        assertEquals(3, e.getProblems().size(), e.getProblems().toString());
        assertEquals("invalid_component", e.reason());

        assertThrows(InvalidComponentException.class,
            () -> codec.compose("W1", "QUICK", "AT_EVENT", "NONE", "LONG", 4));
    }

    @Test
    @DisplayName("Bad suffixes are rejected")
    void testInvalidSuffix() {
        assertThrows(InvalidSuffixException.class,
            () -> codec.compose("W1", "QUICK", "AT_EVENT", "NONE", "LONG", 1, "ABC123"));
        assertThrows(InvalidSuffixException.class,
            () -> codec.compose("W1", "QUICK", "AT_EVENT", "NONE", "LONG", 1, "abc12"));
    }

    @Test
    @DisplayName("Malformed text cannot be parsed")
    void testMalformed() {
        assertThrows(MalformedIdentifierException.class, () -> codec.parse(""));
        assertThrows(MalformedIdentifierException.class, () -> codec.parse(null));
        assertThrows(MalformedIdentifierException.class, () -> codec.parse("W1_QUICK_AT_EVENT"));
        assertThrows(MalformedIdentifierException.class, () -> codec.parse("W1__QUICK_AT_EVENT_NONE_LONG_1"));
        assertThrows(MalformedIdentifierException.class, () -> codec.parse("W1_QUICK_AT_EVENT_NONE_LONG_X"));
        assertThrows(MalformedIdentifierException.class, () -> codec.parse("W1_QUICK_AT_EVENT_NONE_LONG_1_abc123_zzz999"));
        assertThrows(MalformedIdentifierException.class, () -> codec.parse("W1_QUICK_AT_EVENT_NONE_LONG_1_ABC"));
        assertThrows(MalformedIdentifierException.class, () -> codec.parse("W1_QUICK_AT_EVENT_NONE_LONG_01"));
    }

    @Test
    @DisplayName("Validate never throws and rejects vocabulary violations")
    void testValidate() {
        assertFalse(codec.validate("garbage"));
        assertFalse(codec.validate(null));
        assertFalse(codec.validate("W9_QUICK_AT_EVENT_NONE_LONG_1"));
        assertTrue(codec.validate("BE_EXTENDED_POST_30M_NONE_ANY_3_zz9zz9"));
    }

    @Test
    @DisplayName("Chain position follows the generation")
    void testChainPosition() {
        assertEquals(ChainPosition.O, codec.chainPosition(1));
        assertEquals(ChainPosition.R1, codec.chainPosition(2));
        assertEquals(ChainPosition.R2, codec.chainPosition(3));
        assertThrows(InvalidGenerationException.class, () -> codec.chainPosition(4));
    }

    @Test
    @DisplayName("Comment form fits the MT4 comment limit")
    void testCommentForm() {
        String form = codec.commentForm(EXAMPLE);
        assertEquals("W1_QUIC_AT_1_429f86", form);
        assertTrue(form.length() <= HybridIdCodec.COMMENT_MAX_LENGTH);

        assertEquals(codec.commentHash("not-an-identifier"), codec.commentForm("not-an-identifier"));
    }

    @Test
    @DisplayName("Rejections are counted by error code")
    void testRejectionMetrics() {
        ReentryMetrics metrics = mock(ReentryMetrics.class);
        HybridIdCodec counted = new HybridIdCodec(vocabulary, metrics);

        assertThrows(MalformedIdentifierException.class, () -> counted.parse("nope"));
        assertFalse(counted.validate("W9_QUICK_AT_EVENT_NONE_LONG_1"));

        verify(metrics).recordCodecRejection("malformed_identifier");
        verify(metrics).recordCodecRejection("invalid_component");
    }
}
