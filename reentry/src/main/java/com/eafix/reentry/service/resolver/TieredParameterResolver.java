package com.eafix.reentry.service.resolver;

import com.eafix.reentry.application.lifecycle.ComponentHealth;
import com.eafix.reentry.application.lifecycle.ManagedComponent;
import com.eafix.reentry.application.monitoring.AlertService;
import com.eafix.reentry.domain.decision.OutcomeClass;
import com.eafix.reentry.domain.monitoring.Alert;
import com.eafix.reentry.domain.monitoring.AlertLevel;
import com.eafix.reentry.domain.resolver.ParameterSet;
import com.eafix.reentry.domain.resolver.ParameterSetLoadException;
import com.eafix.reentry.domain.resolver.ResolvedParameters;
import com.eafix.reentry.domain.resolver.Tier;
import com.eafix.reentry.domain.vocab.ReentryVocabulary;
import com.eafix.reentry.infrastructure.metrics.ReentryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Selects re-entry parameters by walking the tier hierarchy.
 *
 * Resolution rules:
 * - Tiers are tried in hierarchy order; the first tier with any match wins outright
 * - Within a tier the highest specificity wins, ties go to the smallest set id
 * - No match in any tier yields the EMERGENCY fallback (re-entry disabled) and a CRITICAL alert
 *
 * The loaded sets live in an immutable snapshot swapped atomically on reload, so
 * concurrent {@link #resolve} calls never see a half-applied reload.
 */
public final class TieredParameterResolver implements ManagedComponent {
    private static final Logger log = LoggerFactory.getLogger(TieredParameterResolver.class);
    private static final String COMPONENT = "resolver";

    private final List<Tier> hierarchy;
    private final Path parameterFile;
    private final boolean writeDefaultsWhenMissing;
    private final ParameterSetLoader loader;
    private final ReentryMetrics metrics;
    private final AlertService alertService;
    private final Clock clock;

    private final AtomicReference<ParameterSnapshot> snapshot = new AtomicReference<>(ParameterSnapshot.EMPTY);

    public TieredParameterResolver(ReentryVocabulary vocabulary, List<Tier> hierarchy) {
        this(vocabulary, hierarchy, null, false, ReentryMetrics.noop(), new AlertService(), Clock.systemUTC());
    }

    public TieredParameterResolver(ReentryVocabulary vocabulary,
                                   List<Tier> hierarchy,
                                   Path parameterFile,
                                   boolean writeDefaultsWhenMissing,
                                   ReentryMetrics metrics,
                                   AlertService alertService,
                                   Clock clock) {
        this.hierarchy = List.copyOf(hierarchy);
        this.parameterFile = parameterFile;
        this.writeDefaultsWhenMissing = writeDefaultsWhenMissing;
        this.loader = new ParameterSetLoader(vocabulary, this.hierarchy);
        this.metrics = metrics;
        this.alertService = alertService;
        this.clock = clock;
    }

    @Override
    public String componentName() {
        return COMPONENT;
    }

    @Override
    public void initialize() {
        loadParameterSets(parameterFile);
    }

    @Override
    public void start() {
        log.info("[Resolver] Started with {} parameter sets, hierarchy {}", snapshot.get().all().size(), hierarchy);
    }

    @Override
    public void stop() {
        log.info("[Resolver] Stopped");
    }

    @Override
    public ComponentHealth healthCheck() {
        ResolverStatus status = status();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("active_parameter_sets", status.activeParameterSets());
        details.put("source", status.source());
        if (status.activeParameterSets() == 0) {
            return ComponentHealth.degraded(COMPONENT, "no active parameter sets", details);
        }
        if (status.tierCounts().getOrDefault(Tier.GLOBAL, 0) == 0) {
            return ComponentHealth.degraded(COMPONENT, "no GLOBAL parameter set, emergency fallback reachable", details);
        }
        return ComponentHealth.healthy(COMPONENT, details);
    }

    /**
     * Load parameter sets from a file and install them.
     *
     * A missing file (or null path) installs the built-in defaults. A file that fails
     * validation throws and leaves the current sets active.
     *
     * @throws ParameterSetLoadException if the file is invalid
     */
    public void loadParameterSets(Path file) {
        if (file == null || !Files.exists(file)) {
            log.info("No parameter set file at {}, using built-in defaults", file);
            List<ParameterSet> defaults = DefaultParameterSets.builtIn();
            install(defaults, "built-in");
            if (file != null && writeDefaultsWhenMissing) {
                try {
                    loader.write(file, defaults);
                } catch (IOException e) {
                    log.warn("Could not write default parameter sets to {}: {}", file, e.getMessage());
                }
            }
            return;
        }
        List<ParameterSet> sets = loader.read(file);
        install(sets, file.toString());
    }

    /**
     * Re-read the configured parameter file. On failure the previous sets stay active
     * and a MEDIUM alert is raised before the exception propagates.
     */
    public void reload() {
        try {
            loadParameterSets(parameterFile);
        } catch (ParameterSetLoadException e) {
            alertService.sendAlert(Alert.builder()
                .alertType(Alert.PARAMETER_RELOAD_REJECTED)
                .level(AlertLevel.MEDIUM)
                .component(COMPONENT)
                .raisedAt(clock.instant())
                .message(e.getMessage())
                .detail("problems", e.getProblems().size())
                .build());
            throw e;
        }
    }

    /**
     * Validate and atomically install a set collection.
     *
     * @throws ParameterSetLoadException if any set is invalid
     */
    public void install(List<ParameterSet> sets, String source) {
        List<String> problems = loader.validate(sets);
        if (!problems.isEmpty()) {
            throw new ParameterSetLoadException(source, problems);
        }
        snapshot.set(new ParameterSnapshot(sets, clock.instant(), source));
        log.info("✅ Loaded {} parameter sets from {}", sets.size(), source);
    }

    /**
     * Resolve parameters for a decision context.
     */
    public ResolvedParameters resolve(OutcomeClass outcome, String duration, String proximity,
                                      String calendar, String symbol, int generation) {
        ParameterSnapshot current = snapshot.get();

        for (Tier tier : hierarchy) {
            ParameterSet best = null;
            double bestScore = -1.0;
            for (ParameterSet set : current.forTier(tier)) {
                OptionalDouble score = ParameterMatcher.score(set, outcome, duration, proximity, calendar, symbol);
                if (score.isEmpty()) {
                    continue;
                }
                log.debug("[Resolver] {} {} matched with specificity {}", tier, set.id(), score.getAsDouble());
                // Sets are sorted by id, so strict comparison keeps the smallest id on ties
                if (score.getAsDouble() > bestScore) {
                    best = set;
                    bestScore = score.getAsDouble();
                }
            }
            if (best != null) {
                ResolvedParameters result = ResolvedParameters.from(best, tier, bestScore, generation);
                metrics.recordResolution(tier.name());
                log.info("Resolved parameters: set={} tier={} specificity={} reentryEnabled={}",
                    best.id(), tier, bestScore, best.reentryEnabled());
                return result;
            }
        }

        metrics.recordResolverExhausted();
        String context = String.format("outcome=%s duration=%s proximity=%s calendar=%s symbol=%s generation=%d",
            outcome, duration, proximity, calendar, symbol, generation);
        log.error("No parameter set matched ({}), using emergency fallback", context);
        alertService.sendAlert(Alert.builder()
            .alertType(Alert.RESOLVER_EXHAUSTED)
            .level(AlertLevel.CRITICAL)
            .component(COMPONENT)
            .raisedAt(clock.instant())
            .message("No parameter set matched, re-entry disabled: " + context)
            .detail("symbol", String.valueOf(symbol))
            .detail("hierarchy", hierarchy.toString())
            .build());
        return ResolvedParameters.emergency(generation);
    }

    /**
     * Active sets in one tier, sorted by id.
     */
    public List<ParameterSet> parameterSetsForTier(Tier tier) {
        return snapshot.get().forTier(tier).stream()
            .filter(ParameterSet::active)
            .toList();
    }

    public ResolverStatus status() {
        ParameterSnapshot current = snapshot.get();
        Map<Tier, Integer> counts = new EnumMap<>(Tier.class);
        for (Tier tier : hierarchy) {
            counts.put(tier, parameterSetsForTier(tier).size());
        }
        int active = (int) current.all().stream().filter(ParameterSet::active).count();
        return new ResolverStatus(current.all().size(), active, hierarchy, counts, current.loadedAt(), current.source());
    }

    public List<Tier> hierarchy() {
        return hierarchy;
    }
}
