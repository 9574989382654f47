package com.eafix.reentry.service.decision;

import com.eafix.reentry.config.ReentrySettings.ClassificationSettings;
import com.eafix.reentry.config.ReentrySettings.OutcomeMappingSettings;
import com.eafix.reentry.domain.decision.DurationClass;
import com.eafix.reentry.domain.decision.OutcomeClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for outcome/duration classification and outcome token mapping.
 */
@DisplayName("Trade Classification Tests")
class TradeClassifierTest {

    private final TradeClassifier classifier = new TradeClassifier(ClassificationSettings.defaults());

    @Test
    @DisplayName("Outcome thresholds are inclusive")
    void testOutcomeClassification() {
        assertEquals(OutcomeClass.WIN, classifier.classifyOutcome(25.0));
        assertEquals(OutcomeClass.WIN, classifier.classifyOutcome(5.0));
        assertEquals(OutcomeClass.BREAKEVEN, classifier.classifyOutcome(4.9));
        assertEquals(OutcomeClass.BREAKEVEN, classifier.classifyOutcome(0.0));
        assertEquals(OutcomeClass.BREAKEVEN, classifier.classifyOutcome(-4.9));
        assertEquals(OutcomeClass.LOSS, classifier.classifyOutcome(-5.0));
        assertEquals(OutcomeClass.LOSS, classifier.classifyOutcome(-80.0));
    }

    @Test
    @DisplayName("Duration upper bounds are inclusive, EXTENDED is above LONG")
    void testDurationClassification() {
        assertEquals(DurationClass.FLASH, classifier.classifyDuration(0.5));
        assertEquals(DurationClass.FLASH, classifier.classifyDuration(5.0));
        assertEquals(DurationClass.QUICK, classifier.classifyDuration(5.01));
        assertEquals(DurationClass.QUICK, classifier.classifyDuration(15.0));
        assertEquals(DurationClass.QUICK, classifier.classifyDuration(30.0));
        assertEquals(DurationClass.LONG, classifier.classifyDuration(31.0));
        assertEquals(DurationClass.LONG, classifier.classifyDuration(240.0));
        assertEquals(DurationClass.EXTENDED, classifier.classifyDuration(240.5));
    }

    @Test
    @DisplayName("Without strong thresholds only W1, L1 and BE are produced")
    void testDefaultTokenMapping() {
        OutcomeTokenMapper mapper = new OutcomeTokenMapper(OutcomeMappingSettings.defaults());
        assertFalse(mapper.usesStrongTokens());
        assertEquals("W1", mapper.token(OutcomeClass.WIN, 500.0));
        assertEquals("L1", mapper.token(OutcomeClass.LOSS, -500.0));
        assertEquals("BE", mapper.token(OutcomeClass.BREAKEVEN, 1.0));
    }

    @Test
    @DisplayName("Configured strong thresholds produce W2 and L2")
    void testStrongTokenMapping() {
        OutcomeTokenMapper mapper = new OutcomeTokenMapper(new OutcomeMappingSettings(40.0, -40.0));
        assertTrue(mapper.usesStrongTokens());
        assertEquals("W1", mapper.token(OutcomeClass.WIN, 39.9));
        assertEquals("W2", mapper.token(OutcomeClass.WIN, 40.0));
        assertEquals("L1", mapper.token(OutcomeClass.LOSS, -39.9));
        assertEquals("L2", mapper.token(OutcomeClass.LOSS, -40.0));
    }
}
