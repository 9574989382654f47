package com.eafix.reentry.service.decision;

import com.eafix.reentry.config.ReentrySettings;
import com.eafix.reentry.config.ReentrySettings.EligibilitySettings;
import com.eafix.reentry.domain.decision.DecisionContext;
import com.eafix.reentry.domain.decision.DecisionResponse;
import com.eafix.reentry.domain.decision.InvalidContextException;
import com.eafix.reentry.domain.resolver.ParameterSet;
import com.eafix.reentry.domain.resolver.Tier;
import com.eafix.reentry.domain.vocab.ReentryVocabulary;
import com.eafix.reentry.infrastructure.ledger.IntegrityLedger;
import com.eafix.reentry.infrastructure.metrics.ReentryMetrics;
import com.eafix.reentry.service.codec.HybridIdCodec;
import com.eafix.reentry.service.resolver.TieredParameterResolver;
import com.eafix.reentry.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent decisions through DecisionExecutor.
 */
@DisplayName("Decision Executor Tests")
class DecisionExecutorTest {

    @TempDir
    Path ledgerDir;

    private DecisionProcessor processor;
    private DecisionExecutor executor;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2025-01-18T09:30:00Z"));
        ReentryVocabulary vocabulary = ReentryVocabulary.defaults();
        TieredParameterResolver resolver = new TieredParameterResolver(vocabulary, Tier.defaultHierarchy());
        resolver.install(List.of(ParameterSet.builder("global", Tier.GLOBAL).build()), "test");
        IntegrityLedger ledger = new IntegrityLedger(ledgerDir, clock);
        ledger.initialize();

        ReentrySettings settings = ReentrySettings.defaults()
            .withEligibility(new EligibilitySettings(true, 1.0, false, 0, 3));
        processor = new DecisionProcessor(settings, new HybridIdCodec(vocabulary), resolver, ledger,
            ReentryMetrics.noop(), clock);
        processor.initialize();
        processor.start();
        executor = new DecisionExecutor(processor, 8);
        executor.initialize();
        executor.start();
    }

    @AfterEach
    void tearDown() {
        executor.stop();
    }

    private static DecisionContext trade(String id, String symbol) {
        return new DecisionContext(id, symbol, "SHORT", "POST_30M", "NONE", 1,
            new BigDecimal("0.20"), 12.0, 20.0, Instant.parse("2025-01-18T09:29:00Z"), "TP");
    }

    @Test
    @DisplayName("Same-symbol decisions are serialized: the daily cap is never exceeded")
    void testPerSymbolSerialization() throws Exception {
        List<CompletableFuture<DecisionResponse>> futures = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            futures.add(executor.submit(trade("T-" + i, "EURUSD")));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);

        long accepted = futures.stream().map(CompletableFuture::join).filter(r -> !r.isSkipped()).count();
        long capped = futures.stream().map(CompletableFuture::join)
            .filter(r -> "daily_limit_exceeded".equals(r.reason())).count();
        assertEquals(3, accepted);
        assertEquals(17, capped);
    }

    @Test
    @DisplayName("Concurrent decisions across symbols get distinct, gap-free sequence numbers")
    void testSequenceUnderConcurrency() throws Exception {
        List<CompletableFuture<DecisionResponse>> futures = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            futures.add(executor.submit(trade("T-" + i, String.format("SYM%03d", i))));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);

        List<Long> sequences = futures.stream().map(CompletableFuture::join)
            .map(DecisionResponse::fileSeq).sorted().toList();
        assertEquals(40, sequences.size());
        for (int i = 0; i < sequences.size(); i++) {
            assertEquals(i + 1L, sequences.get(i));
        }
    }

    @Test
    @DisplayName("Processor exceptions complete the future exceptionally")
    void testInvalidContextPropagates() {
        CompletableFuture<DecisionResponse> future = executor.submit(trade("", "EURUSD"));
        CompletionException e = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(InvalidContextException.class, e.getCause());
    }

    @Test
    @DisplayName("Stopped executor rejects work")
    void testStopped() {
        executor.stop();
        assertThrows(IllegalStateException.class, () -> executor.submit(trade("T-1", "EURUSD")));
        assertFalse(executor.healthCheck().isHealthy());
    }
}
