package com.eafix.reentry.service.decision;

import com.eafix.reentry.config.ReentrySettings.EligibilitySettings;
import com.eafix.reentry.domain.decision.DecisionContext;
import com.eafix.reentry.domain.decision.SkipReason;
import com.eafix.reentry.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EligibilityGate and SymbolActivityTracker.
 *
 * Tests:
 * - Each skip reason
 * - Cooldown expiry
 * - Daily attempt cap and UTC day reset
 */
@DisplayName("Eligibility Gate Tests")
class EligibilityGateTest {

    private MutableClock clock;
    private SymbolActivityTracker tracker;
    private EligibilityGate gate;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-18T10:00:00Z"));
        tracker = new SymbolActivityTracker(clock);
        gate = new EligibilityGate(new EligibilitySettings(true, 1.0, true, 15, 2), tracker);
    }

    private static DecisionContext trade(String symbol, Instant closeTime, double minutes, String closeReason) {
        return new DecisionContext("T-1", symbol, "LONG", "AT_EVENT", "NONE", 1,
            new BigDecimal("0.10"), 10.0, minutes, closeTime, closeReason);
    }

    @Test
    @DisplayName("Closed trade of sufficient duration is eligible")
    void testEligible() {
        assertEquals(Optional.empty(), gate.check(trade("EURUSD", clock.instant(), 15.0, "TP")));
    }

    @Test
    @DisplayName("Open trades are skipped when only completed trades count")
    void testOpenTrade() {
        assertEquals(Optional.of(SkipReason.TRADE_NOT_COMPLETED), gate.check(trade("EURUSD", null, 15.0, null)));

        EligibilityGate lenient = new EligibilityGate(new EligibilitySettings(false, null, null, null, null), tracker);
        assertEquals(Optional.empty(), lenient.check(trade("EURUSD", null, 15.0, null)));
    }

    @Test
    @DisplayName("Short trades are skipped")
    void testDurationTooShort() {
        assertEquals(Optional.of(SkipReason.DURATION_TOO_SHORT), gate.check(trade("EURUSD", clock.instant(), 0.5, "TP")));
        assertEquals(Optional.empty(), gate.check(trade("EURUSD", clock.instant(), 1.0, "TP")));
    }

    @Test
    @DisplayName("Manual closes are skipped when excluded")
    void testManualClose() {
        assertEquals(Optional.of(SkipReason.MANUAL_CLOSE_EXCLUDED),
            gate.check(trade("EURUSD", clock.instant(), 15.0, "manual")));
    }

    @Test
    @DisplayName("Cooldown applies per symbol and expires")
    void testCooldown() {
        tracker.recordDecision("EURUSD", true);

        clock.advance(Duration.ofMinutes(14));
        assertEquals(Optional.of(SkipReason.COOLDOWN_PERIOD_ACTIVE), gate.check(trade("EURUSD", clock.instant(), 15.0, "TP")));
        assertEquals(Optional.empty(), gate.check(trade("GBPUSD", clock.instant(), 15.0, "TP")));

        clock.advance(Duration.ofMinutes(1));
        assertEquals(Optional.empty(), gate.check(trade("EURUSD", clock.instant(), 15.0, "TP")));
    }

    @Test
    @DisplayName("Daily cap counts only re-entries and resets on the UTC date")
    void testDailyLimit() {
        tracker.recordDecision("EURUSD", true);
        clock.advance(Duration.ofMinutes(20));
        tracker.recordDecision("EURUSD", false);
        clock.advance(Duration.ofMinutes(20));
        assertEquals(1, tracker.attemptsToday("EURUSD"));
        tracker.recordDecision("EURUSD", true);
        clock.advance(Duration.ofMinutes(20));

        assertEquals(2, tracker.attemptsToday("EURUSD"));
        assertEquals(Optional.of(SkipReason.DAILY_LIMIT_EXCEEDED), gate.check(trade("EURUSD", clock.instant(), 15.0, "TP")));

        clock.set(Instant.parse("2025-01-19T00:00:01Z"));
        assertEquals(0, tracker.attemptsToday("EURUSD"));
        assertEquals(Optional.empty(), gate.check(trade("EURUSD", clock.instant(), 15.0, "TP")));
    }

    @Test
    @DisplayName("Checks run in a fixed order")
    void testOrder() {
        tracker.recordDecision("EURUSD", true);
        assertEquals(Optional.of(SkipReason.TRADE_NOT_COMPLETED), gate.check(trade("EURUSD", null, 0.1, "MANUAL")));
        assertEquals(Optional.of(SkipReason.DURATION_TOO_SHORT), gate.check(trade("EURUSD", clock.instant(), 0.1, "MANUAL")));
        assertEquals(Optional.of(SkipReason.MANUAL_CLOSE_EXCLUDED), gate.check(trade("EURUSD", clock.instant(), 5.0, "MANUAL")));
        assertEquals(Optional.of(SkipReason.COOLDOWN_PERIOD_ACTIVE), gate.check(trade("EURUSD", clock.instant(), 5.0, "SL")));
    }

    @Test
    @DisplayName("Tracker exposes last decision time and can be cleared")
    void testTrackerState() {
        assertTrue(tracker.lastDecisionAt("EURUSD").isEmpty());
        tracker.recordDecision("EURUSD", false);
        assertEquals(Optional.of(clock.instant()), tracker.lastDecisionAt("EURUSD"));
        assertEquals(1, tracker.trackedSymbols());
        tracker.clear("EURUSD");
        assertEquals(0, tracker.trackedSymbols());
    }
}
