package com.eafix.reentry.bootstrap;

import com.eafix.reentry.application.lifecycle.ComponentHealth;
import com.eafix.reentry.application.lifecycle.ManagedComponent;
import com.eafix.reentry.application.monitoring.AlertService;
import com.eafix.reentry.config.ReentrySettings;
import com.eafix.reentry.domain.vocab.ReentryVocabulary;
import com.eafix.reentry.infrastructure.ledger.IntegrityLedger;
import com.eafix.reentry.infrastructure.metrics.PrometheusReentryMetrics;
import com.eafix.reentry.service.codec.HybridIdCodec;
import com.eafix.reentry.service.decision.DecisionExecutor;
import com.eafix.reentry.service.decision.DecisionProcessor;
import com.eafix.reentry.service.decision.SymbolActivityTracker;
import com.eafix.reentry.service.resolver.TieredParameterResolver;
import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Owns every component of the re-entry core.
 *
 * Built once from settings. {@link #start()} initializes and starts components in
 * dependency order (resolver, ledger, processor, executor); {@link #stop()} stops
 * them in reverse.
 */
public final class ReentryContext implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReentryContext.class);

    private final ReentrySettings settings;
    private final ReentryVocabulary vocabulary;
    private final PrometheusReentryMetrics metrics;
    private final AlertService alertService;
    private final HybridIdCodec codec;
    private final TieredParameterResolver resolver;
    private final IntegrityLedger ledger;
    private final DecisionProcessor processor;
    private final DecisionExecutor executor;
    private final List<ManagedComponent> components;

    private final List<ManagedComponent> started = new ArrayList<>();

    public ReentryContext(ReentrySettings settings, Clock clock) {
        this.settings = settings;
        this.vocabulary = settings.vocabularyFile() != null
            ? ReentryVocabulary.load(Paths.get(settings.vocabularyFile()))
            : ReentryVocabulary.defaults();
        StartupConfigValidator.validate(settings, vocabulary);

        this.metrics = new PrometheusReentryMetrics(new CollectorRegistry());
        this.alertService = new AlertService();
        this.codec = new HybridIdCodec(vocabulary, metrics);

        ReentrySettings.ResolverSettings resolverSettings = settings.resolver();
        Path parameterFile = resolverSettings.parameterFile() != null
            ? Paths.get(resolverSettings.parameterFile())
            : null;
        this.resolver = new TieredParameterResolver(vocabulary, resolverSettings.tierHierarchy(), parameterFile,
            resolverSettings.writeDefaultsWhenMissing(), metrics, alertService, clock);

        ReentrySettings.LedgerSettings ledgerSettings = settings.ledger();
        this.ledger = new IntegrityLedger(Paths.get(ledgerSettings.directory()), ledgerSettings.resumeSequence(),
            clock, metrics, alertService);

        this.processor = new DecisionProcessor(settings, codec, resolver, ledger,
            new SymbolActivityTracker(clock), metrics);
        this.executor = new DecisionExecutor(processor, settings.workerThreads());

        this.components = List.of(resolver, ledger, processor, executor);
    }

    public static ReentryContext create(ReentrySettings settings) {
        return new ReentryContext(settings, Clock.systemUTC());
    }

    /**
     * Initialize and start every component. If one fails, those already started are
     * stopped again before the exception propagates.
     */
    public synchronized void start() {
        if (!started.isEmpty()) {
            log.warn("Re-entry core already started; ignoring start");
            return;
        }
        log.info("Starting re-entry core...");
        try {
            for (ManagedComponent component : components) {
                component.initialize();
                component.start();
                started.add(component);
                log.info("✓ {} started", component.componentName());
            }
        } catch (RuntimeException e) {
            log.error("Startup failed: {}", e.getMessage());
            stop();
            throw e;
        }
        log.info("✅ Re-entry core started");
    }

    public synchronized void stop() {
        if (started.isEmpty()) {
            return;
        }
        List<ManagedComponent> reverse = new ArrayList<>(started);
        Collections.reverse(reverse);
        for (ManagedComponent component : reverse) {
            try {
                component.stop();
            } catch (RuntimeException e) {
                log.error("Error stopping {}: {}", component.componentName(), e.getMessage(), e);
            }
        }
        started.clear();
        log.info("Re-entry core stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public List<ComponentHealth> health() {
        return components.stream().map(ManagedComponent::healthCheck).toList();
    }

    public ReentrySettings settings() {
        return settings;
    }

    public ReentryVocabulary vocabulary() {
        return vocabulary;
    }

    public PrometheusReentryMetrics metrics() {
        return metrics;
    }

    public AlertService alertService() {
        return alertService;
    }

    public HybridIdCodec codec() {
        return codec;
    }

    public TieredParameterResolver resolver() {
        return resolver;
    }

    public IntegrityLedger ledger() {
        return ledger;
    }

    public DecisionProcessor processor() {
        return processor;
    }

    public DecisionExecutor executor() {
        return executor;
    }
}
