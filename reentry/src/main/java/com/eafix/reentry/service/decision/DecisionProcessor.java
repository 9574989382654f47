package com.eafix.reentry.service.decision;

import com.eafix.reentry.application.lifecycle.ComponentHealth;
import com.eafix.reentry.application.lifecycle.ManagedComponent;
import com.eafix.reentry.config.ReentrySettings;
import com.eafix.reentry.domain.decision.DecisionContext;
import com.eafix.reentry.domain.decision.DecisionResponse;
import com.eafix.reentry.domain.decision.DurationClass;
import com.eafix.reentry.domain.decision.InvalidContextException;
import com.eafix.reentry.domain.decision.OutcomeClass;
import com.eafix.reentry.domain.decision.ReentryAction;
import com.eafix.reentry.domain.decision.ReentryDecisionRecord;
import com.eafix.reentry.domain.decision.SkipReason;
import com.eafix.reentry.domain.hybrid.ChainPosition;
import com.eafix.reentry.domain.hybrid.HybridId;
import com.eafix.reentry.domain.resolver.ResolvedParameters;
import com.eafix.reentry.domain.vocab.ReentryVocabulary;
import com.eafix.reentry.infrastructure.ledger.IntegrityLedger;
import com.eafix.reentry.infrastructure.ledger.LedgerWriteException;
import com.eafix.reentry.infrastructure.ledger.LedgerWriteResult;
import com.eafix.reentry.infrastructure.metrics.ReentryMetrics;
import com.eafix.reentry.service.codec.HybridIdCodec;
import com.eafix.reentry.service.resolver.TieredParameterResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * DecisionProcessor - Turns one closed trade into a re-entry decision.
 *
 * Flow:
 * 1. Structural validation of the context (all problems reported at once)
 * 2. Eligibility gate (skips are responses, not errors; no ledger row)
 * 3. Outcome and duration classification
 * 4. Tiered parameter resolution
 * 5. Outcome token mapping
 * 6. Identifier composition (current generation, no suffix)
 * 7. Re-entry action
 * 8. Lot size and confidence
 * 9. Ledger append
 * 10. Cooldown and daily attempt tracking
 *
 * Steps 2-10 run under the symbol's lock, so two decisions for the same symbol never
 * interleave between the eligibility check and the tracking update.
 */
public final class DecisionProcessor implements ManagedComponent {
    private static final Logger log = LoggerFactory.getLogger(DecisionProcessor.class);
    private static final String COMPONENT = "decision-processor";

    static final Pattern SYMBOL_PATTERN = Pattern.compile("^[A-Za-z0-9._#]{6,8}$");

    private final ReentryVocabulary vocabulary;
    private final HybridIdCodec codec;
    private final TieredParameterResolver resolver;
    private final IntegrityLedger ledger;
    private final SymbolActivityTracker tracker;
    private final EligibilityGate eligibilityGate;
    private final TradeClassifier classifier;
    private final OutcomeTokenMapper tokenMapper;
    private final LotSizer lotSizer;
    private final ReentryMetrics metrics;
    private final int recentLimit;

    private final Deque<DecisionResponse> recentDecisions = new ArrayDeque<>();
    private final Map<ReentryAction, AtomicLong> actionCounts = new EnumMap<>(ReentryAction.class);
    private final Map<SkipReason, AtomicLong> skipCounts = new EnumMap<>(SkipReason.class);
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong ledgerFailures = new AtomicLong();

    private volatile boolean running = false;

    public DecisionProcessor(ReentrySettings settings,
                             HybridIdCodec codec,
                             TieredParameterResolver resolver,
                             IntegrityLedger ledger,
                             SymbolActivityTracker tracker,
                             ReentryMetrics metrics) {
        this.vocabulary = codec.vocabulary();
        this.codec = codec;
        this.resolver = resolver;
        this.ledger = ledger;
        this.tracker = tracker;
        this.eligibilityGate = new EligibilityGate(settings.eligibility(), tracker);
        this.classifier = new TradeClassifier(settings.classification());
        this.tokenMapper = new OutcomeTokenMapper(settings.outcomeMapping());
        this.lotSizer = new LotSizer(settings.sizing());
        this.metrics = metrics;
        this.recentLimit = settings.recentDecisionLimit();
        for (ReentryAction action : ReentryAction.values()) {
            actionCounts.put(action, new AtomicLong());
        }
        for (SkipReason reason : SkipReason.values()) {
            skipCounts.put(reason, new AtomicLong());
        }
    }

    /**
     * Convenience constructor with a fresh activity tracker on the given clock.
     */
    public DecisionProcessor(ReentrySettings settings,
                             HybridIdCodec codec,
                             TieredParameterResolver resolver,
                             IntegrityLedger ledger,
                             ReentryMetrics metrics,
                             Clock clock) {
        this(settings, codec, resolver, ledger, new SymbolActivityTracker(clock), metrics);
    }

    @Override
    public String componentName() {
        return COMPONENT;
    }

    @Override
    public void initialize() {
        log.info("[Processor] Initialized (strong outcome tokens {})",
            tokenMapper.usesStrongTokens() ? "enabled" : "disabled");
    }

    @Override
    public void start() {
        running = true;
        log.info("[Processor] Accepting decisions");
    }

    @Override
    public void stop() {
        running = false;
        log.info("[Processor] Stopped after {} decisions", processed.get());
    }

    @Override
    public ComponentHealth healthCheck() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("processed", processed.get());
        details.put("ledger_failures", ledgerFailures.get());
        if (!running) {
            return ComponentHealth.unhealthy(COMPONENT, "not running");
        }
        return ComponentHealth.healthy(COMPONENT, details);
    }

    /**
     * Process one decision context.
     *
     * @return an accepted decision or a skip
     * @throws InvalidContextException if the context is structurally invalid
     * @throws LedgerWriteException if the decision could not be recorded; tracking is not updated
     * @throws IllegalStateException if the processor has not been started
     */
    public DecisionResponse process(DecisionContext context) {
        if (!running) {
            throw new IllegalStateException("Decision processor is not running");
        }
        long started = System.nanoTime();
        List<String> problems = validateStructure(context);
        if (!problems.isEmpty()) {
            rejected.incrementAndGet();
            String tradeId = context != null ? context.tradeId() : null;
            log.warn("Rejected decision context for trade {}: {}", tradeId, problems);
            throw new InvalidContextException(tradeId, problems);
        }

        DecisionResponse response = tracker.withSymbolLock(context.symbol(), () -> decide(context));

        processed.incrementAndGet();
        Duration latency = Duration.ofNanos(System.nanoTime() - started);
        String action = response.reentryAction() != null ? response.reentryAction().name() : "none";
        metrics.recordDecision(response.status(), action, latency);
        remember(response);
        return response;
    }

    private DecisionResponse decide(DecisionContext context) {
        Optional<SkipReason> skip = eligibilityGate.check(context);
        if (skip.isPresent()) {
            SkipReason reason = skip.get();
            skipCounts.get(reason).incrementAndGet();
            metrics.recordSkip(reason.reason());
            log.info("Skipped trade {} on {}: {}", context.tradeId(), context.symbol(), reason.reason());
            return DecisionResponse.skipped(context.tradeId(), reason);
        }

        OutcomeClass outcome = classifier.classifyOutcome(context.profitLossPips());
        DurationClass duration = classifier.classifyDuration(context.durationMinutes());
        String calendar = calendarOf(context);
        int generation = context.generation();

        ResolvedParameters params = resolver.resolve(outcome, duration.name(), context.proximityState(),
            calendar, context.symbol(), generation);

        String outcomeToken = tokenMapper.token(outcome, context.profitLossPips());
        HybridId id = codec.compose(outcomeToken, duration.name(), context.proximityState(), calendar,
            context.direction(), generation);
        String commentSuffix = codec.commentHash(id);

        ReentryAction action = determineAction(params, generation);
        ChainPosition chainPosition = codec.chainPosition(generation);
        BigDecimal lotSize = lotSizer.size(context.symbol(), context.currentLotSize(), params.lotSizeMultiplier());
        double confidence = ConfidenceScorer.score(params.confidenceThreshold(), params.specificityScore(),
            outcome, generation);

        ReentryDecisionRecord record = new ReentryDecisionRecord(
            context.tradeId(),
            id.value(),
            context.symbol(),
            outcome,
            duration,
            action,
            params.parameterSetId(),
            params.resolvedTier(),
            chainPosition,
            lotSize,
            params.stopLossPips(),
            params.takeProfitPips());

        LedgerWriteResult written;
        try {
            written = ledger.append(record);
        } catch (LedgerWriteException e) {
            ledgerFailures.incrementAndGet();
            log.error("Decision for trade {} not recorded: {}", context.tradeId(), e.getMessage());
            throw e;
        }

        tracker.recordDecision(context.symbol(), action.isReentry());
        actionCounts.get(action).incrementAndGet();

        log.info("✅ Decision {} for trade {} ({}): {} via {}/{} lot={} confidence={} file_seq={}",
            action, context.tradeId(), id.value(), outcome, params.resolvedTier(), params.parameterSetId(),
            lotSize.toPlainString(), confidence, written.fileSeq());

        return new DecisionResponse(
            DecisionResponse.STATUS_ACCEPTED,
            null,
            context.tradeId(),
            id.value(),
            commentSuffix,
            outcome,
            duration,
            action,
            params.parameterSetId(),
            params.resolvedTier().name(),
            chainPosition.name(),
            lotSize,
            params.stopLossPips(),
            params.takeProfitPips(),
            confidence,
            written.fileSeq(),
            written.checksum());
    }

    /**
     * NO_REENTRY when disabled or already at the matched max generation; otherwise the
     * chain label of the next generation, HOLD when it has none.
     */
    static ReentryAction determineAction(ResolvedParameters params, int generation) {
        if (!params.reentryEnabled() || generation >= params.maxGeneration()) {
            return ReentryAction.NO_REENTRY;
        }
        switch (generation + 1) {
            case 2:
                return ReentryAction.R1;
            case 3:
                return ReentryAction.R2;
            default:
                return ReentryAction.HOLD;
        }
    }

    List<String> validateStructure(DecisionContext context) {
        List<String> problems = new ArrayList<>();
        if (context == null) {
            problems.add("context is required");
            return problems;
        }
        if (context.tradeId() == null || context.tradeId().isBlank()) {
            problems.add("trade_id is required");
        }
        if (context.symbol() == null || !SYMBOL_PATTERN.matcher(context.symbol()).matches()) {
            problems.add("symbol must be 6-8 characters of [A-Za-z0-9._#], got '" + context.symbol() + "'");
        }
        if (!vocabulary.isValidDirection(context.direction())) {
            problems.add("direction '" + context.direction() + "' is not a legal direction");
        }
        if (!vocabulary.isValidProximity(context.proximityState())) {
            problems.add("proximity_state '" + context.proximityState() + "' is not a legal proximity state");
        }
        if (!vocabulary.isValidCalendar(calendarOf(context))) {
            problems.add("calendar_id '" + context.calendarId() + "' is not a legal calendar identifier");
        }
        if (context.generation() == null) {
            problems.add("generation is required");
        } else if (!vocabulary.isValidGeneration(context.generation())
            || ChainPosition.forGeneration(context.generation()).isEmpty()) {
            problems.add("generation " + context.generation() + " is out of range");
        }
        if (context.currentLotSize() == null || context.currentLotSize().signum() <= 0) {
            problems.add("current_lot_size must be positive");
        }
        if (context.profitLossPips() == null || !Double.isFinite(context.profitLossPips())) {
            problems.add("profit_loss_pips must be a finite number");
        }
        if (context.durationMinutes() == null || !Double.isFinite(context.durationMinutes())
            || context.durationMinutes() < 0) {
            problems.add("duration_minutes must be a non-negative number");
        }
        return problems;
    }

    private static String calendarOf(DecisionContext context) {
        return context.calendarId() != null ? context.calendarId() : ReentryVocabulary.CALENDAR_NONE;
    }

    private void remember(DecisionResponse response) {
        synchronized (recentDecisions) {
            recentDecisions.addFirst(response);
            while (recentDecisions.size() > recentLimit) {
                recentDecisions.removeLast();
            }
        }
    }

    /**
     * Most recent decisions, newest first.
     */
    public List<DecisionResponse> recentDecisions() {
        synchronized (recentDecisions) {
            return List.copyOf(recentDecisions);
        }
    }

    /**
     * Counters since start: processed, rejected, ledger failures, per action and per skip reason.
     */
    public Map<String, Object> processingStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("processed", processed.get());
        stats.put("rejected", rejected.get());
        stats.put("ledger_failures", ledgerFailures.get());
        Map<String, Long> actions = new LinkedHashMap<>();
        actionCounts.forEach((action, count) -> actions.put(action.name(), count.get()));
        stats.put("actions", actions);
        Map<String, Long> skips = new LinkedHashMap<>();
        skipCounts.forEach((reason, count) -> skips.put(reason.reason(), count.get()));
        stats.put("skips", skips);
        stats.put("tracked_symbols", tracker.trackedSymbols());
        stats.put("last_file_seq", ledger.lastSequence());
        return stats;
    }

    public SymbolActivityTracker tracker() {
        return tracker;
    }
}
