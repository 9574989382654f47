package com.eafix.reentry.service.decision;

import com.eafix.reentry.config.ReentrySettings;
import com.eafix.reentry.config.ReentrySettings.EligibilitySettings;
import com.eafix.reentry.domain.decision.DecisionContext;
import com.eafix.reentry.domain.decision.DecisionResponse;
import com.eafix.reentry.domain.decision.DurationClass;
import com.eafix.reentry.domain.decision.InvalidContextException;
import com.eafix.reentry.domain.decision.OutcomeClass;
import com.eafix.reentry.domain.decision.ReentryAction;
import com.eafix.reentry.domain.decision.ReentryDecisionRecord;
import com.eafix.reentry.domain.resolver.ParameterSet;
import com.eafix.reentry.domain.resolver.Tier;
import com.eafix.reentry.domain.vocab.ReentryVocabulary;
import com.eafix.reentry.infrastructure.ledger.IntegrityLedger;
import com.eafix.reentry.infrastructure.ledger.LedgerValidator;
import com.eafix.reentry.infrastructure.ledger.LedgerWriteException;
import com.eafix.reentry.infrastructure.ledger.ValidationReport;
import com.eafix.reentry.infrastructure.metrics.ReentryMetrics;
import com.eafix.reentry.service.codec.HybridIdCodec;
import com.eafix.reentry.service.resolver.TieredParameterResolver;
import com.eafix.reentry.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for DecisionProcessor.
 *
 * Tests:
 * - GLOBAL-only resolution of a 25 pip, 15 minute win
 * - Skips produce no ledger row
 * - Structural validation reports every problem
 * - Calendars with empty segments never reach the ledger
 * - Action selection across generations and disabled sets
 * - Ledger failures leave tracking untouched
 */
@DisplayName("Decision Processor Tests")
class DecisionProcessorTest {

    @TempDir
    Path ledgerDir;

    private MutableClock clock;
    private HybridIdCodec codec;
    private TieredParameterResolver resolver;
    private IntegrityLedger ledger;
    private DecisionProcessor processor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-18T13:45:00Z"));
        ReentryVocabulary vocabulary = ReentryVocabulary.defaults();
        codec = new HybridIdCodec(vocabulary);
        resolver = new TieredParameterResolver(vocabulary, Tier.defaultHierarchy());
        resolver.install(List.of(
            ParameterSet.builder("global_only", Tier.GLOBAL)
                .reentryEnabled(true)
                .lotSizeMultiplier(1.0)
                .build()
        ), "test");
        ledger = new IntegrityLedger(ledgerDir, clock);
        ledger.initialize();
        processor = newProcessor(ReentrySettings.defaults(), ledger);
    }

    private DecisionProcessor newProcessor(ReentrySettings settings, IntegrityLedger target) {
        DecisionProcessor p = new DecisionProcessor(settings, codec, resolver, target, ReentryMetrics.noop(), clock);
        p.initialize();
        p.start();
        return p;
    }

    private DecisionContext closedTrade(String symbol, int generation, double pips, double minutes) {
        return new DecisionContext("T-" + symbol + "-" + generation, symbol, "LONG", "AT_EVENT", "NONE",
            generation, new BigDecimal("0.10"), pips, minutes, clock.instant(), "TP");
    }

    private List<Path> ledgerFiles() throws IOException {
        try (Stream<Path> files = Files.list(ledgerDir)) {
            return files.sorted().toList();
        }
    }

    @Test
    @DisplayName("25 pip win over 15 minutes against GLOBAL only re-enters as R1 with the same lot")
    void testGlobalOnlyWin() throws IOException {
        DecisionResponse response = processor.process(closedTrade("EURUSD", 1, 25.0, 15.0));

        assertEquals(DecisionResponse.STATUS_ACCEPTED, response.status());
        assertEquals(OutcomeClass.WIN, response.outcomeClass());
        assertEquals(DurationClass.QUICK, response.durationClass());
        assertEquals(ReentryAction.R1, response.reentryAction());
        assertEquals(0, new BigDecimal("0.10").compareTo(response.lotSize()));
        assertEquals("GLOBAL", response.resolvedTier());
        assertEquals("global_only", response.parameterSetId());
        assertEquals("O", response.chainPosition());
        assertEquals("W1_QUICK_AT_EVENT_NONE_LONG_1", response.identifier());
        assertEquals("f991e2", response.commentSuffix());
        assertEquals(20.0, response.stopLoss());
        assertEquals(40.0, response.takeProfit());
        assertEquals(0.7, response.confidenceScore());
        assertEquals(1L, response.fileSeq());
        assertTrue(response.checksumSha256().matches("^[a-f0-9]{64}$"));

        List<Path> files = ledgerFiles();
        assertEquals(1, files.size());
        assertTrue(files.get(0).getFileName().toString().startsWith(ReentryDecisionRecord.RECORD_TYPE + "_"));
        ValidationReport report = new LedgerValidator().verify(files.get(0));
        assertTrue(report.passed(), report.violations().toString());
        assertEquals(1, report.totalRows());
    }

    @Test
    @DisplayName("Trade shorter than the minimum is skipped without a ledger row")
    void testDurationTooShortSkip() throws IOException {
        DecisionResponse response = processor.process(closedTrade("EURUSD", 1, 25.0, 0.5));

        assertTrue(response.isSkipped());
        assertEquals("duration_too_short", response.reason());
        assertNull(response.identifier());
        assertTrue(ledgerFiles().isEmpty());
        assertEquals(0, ledger.lastSequence());
        assertTrue(processor.tracker().lastDecisionAt("EURUSD").isEmpty());
    }

    @Test
    @DisplayName("Structural problems are reported together")
    void testInvalidContext() {
        DecisionContext bad = new DecisionContext("T-9", "EU", "UP", "AT_EVENT", "CAL9_NOPE_X", null,
            new BigDecimal("-1"), 10.0, Double.NaN, clock.instant(), null);

        InvalidContextException e = assertThrows(InvalidContextException.class, () -> processor.process(bad));
        assertEquals("invalid_context", e.reason());
        assertEquals("T-9", e.getTradeId());
        assertEquals(6, e.getProblems().size(), e.getProblems().toString());
        assertEquals(1L, processor.processingStats().get("rejected"));
    }

    @Test
    @DisplayName("Calendar with an empty segment is rejected before anything is written")
    void testEmptyCalendarSegmentRejected() throws IOException {
        DecisionContext bad = new DecisionContext("T-10", "EURUSD", "LONG", "AT_EVENT", "CAL8__NFP", 1,
            new BigDecimal("0.10"), 25.0, 15.0, clock.instant(), "TP");

        InvalidContextException e = assertThrows(InvalidContextException.class, () -> processor.process(bad));
        assertEquals(1, e.getProblems().size(), e.getProblems().toString());
        assertTrue(e.getProblems().get(0).contains("CAL8__NFP"));
        assertTrue(ledgerFiles().isEmpty());
        assertEquals(0, ledger.lastSequence());
    }

    @Test
    @DisplayName("Later generations map to R2 and then NO_REENTRY at the max")
    void testGenerationActions() {
        assertEquals(ReentryAction.R2, processor.process(closedTrade("EURUSD", 2, -12.0, 45.0)).reentryAction());
        DecisionResponse last = processor.process(closedTrade("GBPUSD", 3, 2.0, 45.0));
        assertEquals(ReentryAction.NO_REENTRY, last.reentryAction());
        assertEquals("R2", last.chainPosition());
    }

    @Test
    @DisplayName("Action selection honours the enabled flag and max generation")
    void testDetermineAction() {
        resolver.install(List.of(
            ParameterSet.builder("two_max", Tier.GLOBAL).maxGeneration(2).build(),
            ParameterSet.builder("flash_off", Tier.TIER3).durationClass("FLASH").reentryEnabled(false).build()
        ), "test");

        DecisionResponse flash = processor.process(closedTrade("EURUSD", 1, 25.0, 3.0));
        assertEquals("flash_off", flash.parameterSetId());
        assertEquals(ReentryAction.NO_REENTRY, flash.reentryAction());

        assertEquals(ReentryAction.R1, processor.process(closedTrade("GBPUSD", 1, 25.0, 15.0)).reentryAction());
        assertEquals(ReentryAction.NO_REENTRY, processor.process(closedTrade("USDJPY", 2, 25.0, 15.0)).reentryAction());
    }

    @Test
    @DisplayName("No matching set still records an EMERGENCY decision without re-entry")
    void testEmergencyDecision() throws IOException {
        resolver.install(List.of(ParameterSet.builder("gbp_only", Tier.TIER1).symbolPattern("GBP*").build()), "test");

        DecisionResponse response = processor.process(closedTrade("EURUSD", 1, 25.0, 15.0));

        assertEquals("EMERGENCY", response.resolvedTier());
        assertEquals(ReentryAction.NO_REENTRY, response.reentryAction());
        assertEquals(1.0, response.confidenceScore());
        assertTrue(new LedgerValidator().verify(ledgerFiles().get(0)).passed());
    }

    @Test
    @DisplayName("Accepted decisions start the symbol cooldown")
    void testCooldownAfterDecision() {
        processor.process(closedTrade("EURUSD", 1, 25.0, 15.0));
        clock.advance(Duration.ofMinutes(5));

        DecisionResponse second = processor.process(closedTrade("EURUSD", 1, 25.0, 15.0));
        assertEquals("cooldown_period_active", second.reason());

        clock.advance(Duration.ofMinutes(10));
        assertEquals(DecisionResponse.STATUS_ACCEPTED, processor.process(closedTrade("EURUSD", 1, 25.0, 15.0)).status());
    }

    @Test
    @DisplayName("Ledger failure propagates and leaves tracking untouched")
    void testLedgerFailure() {
        IntegrityLedger failing = mock(IntegrityLedger.class);
        when(failing.append(any())).thenThrow(new LedgerWriteException(ledgerDir, "disk full", new IOException("disk full")));
        DecisionProcessor p = newProcessor(ReentrySettings.defaults(), failing);

        assertThrows(LedgerWriteException.class, () -> p.process(closedTrade("EURUSD", 1, 25.0, 15.0)));
        assertTrue(p.tracker().lastDecisionAt("EURUSD").isEmpty());
        assertEquals(1L, p.processingStats().get("ledger_failures"));
    }

    @Test
    @DisplayName("Recent decisions and stats are kept")
    @SuppressWarnings("unchecked")
    void testStatsAndRecent() {
        DecisionProcessor limited = newProcessor(ReentrySettings.defaults()
            .withEligibility(new EligibilitySettings(null, null, null, 0, null)), ledger);
        limited.process(closedTrade("EURUSD", 1, 25.0, 15.0));
        limited.process(closedTrade("EURUSD", 1, 25.0, 0.2));
        limited.process(closedTrade("GBPUSD", 2, -25.0, 100.0));

        List<DecisionResponse> recent = limited.recentDecisions();
        assertEquals(3, recent.size());
        assertEquals(ReentryAction.R2, recent.get(0).reentryAction());

        Map<String, Object> stats = limited.processingStats();
        assertEquals(3L, stats.get("processed"));
        assertEquals(1L, ((Map<String, Long>) stats.get("actions")).get("R1"));
        assertEquals(1L, ((Map<String, Long>) stats.get("skips")).get("duration_too_short"));
        assertEquals(2L, stats.get("last_file_seq"));
    }

    @Test
    @DisplayName("Processing requires a started processor")
    void testNotRunning() {
        DecisionProcessor idle = new DecisionProcessor(ReentrySettings.defaults(), codec, resolver, ledger,
            ReentryMetrics.noop(), clock);
        assertThrows(IllegalStateException.class, () -> idle.process(closedTrade("EURUSD", 1, 25.0, 15.0)));
        assertFalse(idle.healthCheck().isHealthy());
    }
}
