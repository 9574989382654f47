package com.eafix.reentry.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.prometheus.client.exporter.common.TextFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Prometheus implementation of ReentryMetrics.
 *
 * Key Metrics:
 * - reentry_decisions_total{status, action}
 * - reentry_decision_latency_seconds
 * - reentry_skips_total{reason}
 * - reentry_resolutions_total{tier}
 * - reentry_resolver_exhausted_total
 * - reentry_ledger_writes_total{record_type, status}
 * - reentry_ledger_write_latency_seconds{record_type}
 * - reentry_ledger_sequence{record_type}
 * - reentry_codec_rejections_total{error}
 *
 * The registry is rendered with {@link #scrape()} for whatever collaborator serves it.
 */
public class PrometheusReentryMetrics implements ReentryMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusReentryMetrics.class);

    private final CollectorRegistry registry;

    // Decision metrics
    private final Counter decisionCounter;
    private final Histogram decisionLatency;
    private final Counter skipCounter;

    // Resolver metrics
    private final Counter resolutionCounter;
    private final Counter exhaustedCounter;

    // Ledger metrics
    private final Counter ledgerWriteCounter;
    private final Histogram ledgerWriteLatency;
    private final Gauge ledgerSequence;

    // Codec metrics
    private final Counter codecRejectionCounter;

    // In-memory totals for status reporting
    private final Map<String, AtomicLong> totals = new ConcurrentHashMap<>();

    public PrometheusReentryMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusReentryMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.decisionCounter = Counter.build()
            .name("reentry_decisions_total")
            .help("Total number of re-entry decisions processed")
            .labelNames("status", "action")
            .register(registry);

        this.decisionLatency = Histogram.build()
            .name("reentry_decision_latency_seconds")
            .help("Decision processing latency in seconds")
            .buckets(0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0)
            .register(registry);

        this.skipCounter = Counter.build()
            .name("reentry_skips_total")
            .help("Total number of decisions skipped by the eligibility gate")
            .labelNames("reason")
            .register(registry);

        this.resolutionCounter = Counter.build()
            .name("reentry_resolutions_total")
            .help("Total number of parameter resolutions by tier")
            .labelNames("tier")
            .register(registry);

        this.exhaustedCounter = Counter.build()
            .name("reentry_resolver_exhausted_total")
            .help("Total number of resolutions that fell back to the emergency parameters")
            .register(registry);

        this.ledgerWriteCounter = Counter.build()
            .name("reentry_ledger_writes_total")
            .help("Total number of ledger appends")
            .labelNames("record_type", "status")
            .register(registry);

        this.ledgerWriteLatency = Histogram.build()
            .name("reentry_ledger_write_latency_seconds")
            .help("Ledger append latency in seconds")
            .labelNames("record_type")
            .buckets(0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0)
            .register(registry);

        this.ledgerSequence = Gauge.build()
            .name("reentry_ledger_sequence")
            .help("Last committed ledger sequence number")
            .labelNames("record_type")
            .register(registry);

        this.codecRejectionCounter = Counter.build()
            .name("reentry_codec_rejections_total")
            .help("Total number of identifiers rejected by the codec")
            .labelNames("error")
            .register(registry);

        log.info("[PrometheusReentryMetrics] Initialized");
    }

    @Override
    public void recordDecision(String status, String action, Duration latency) {
        decisionCounter.labels(status, action).inc();
        decisionLatency.observe(latency.toNanos() / 1_000_000_000.0);
        increment("decisions." + status);
    }

    @Override
    public void recordSkip(String reason) {
        skipCounter.labels(reason).inc();
        increment("skips." + reason);
    }

    @Override
    public void recordResolution(String tier) {
        resolutionCounter.labels(tier).inc();
        increment("resolutions." + tier);
    }

    @Override
    public void recordResolverExhausted() {
        exhaustedCounter.inc();
        increment("resolver.exhausted");
    }

    @Override
    public void recordLedgerWrite(String recordType, boolean success, Duration latency) {
        String status = success ? "success" : "failure";
        ledgerWriteCounter.labels(recordType, status).inc();
        ledgerWriteLatency.labels(recordType).observe(latency.toNanos() / 1_000_000_000.0);
        increment("ledger." + status);
    }

    @Override
    public void updateLedgerSequence(String recordType, long fileSeq) {
        ledgerSequence.labels(recordType).set(fileSeq);
    }

    @Override
    public void recordCodecRejection(String errorCode) {
        codecRejectionCounter.labels(errorCode).inc();
        increment("codec." + errorCode);
    }

    @Override
    public Map<String, Object> getMetrics() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        totals.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(e -> snapshot.put(e.getKey(), e.getValue().get()));
        return snapshot;
    }

    /**
     * Render the registry in the Prometheus text exposition format.
     */
    public String scrape() {
        StringWriter writer = new StringWriter();
        try {
            TextFormat.write004(writer, registry.metricFamilySamples());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render metrics", e);
        }
        return writer.toString();
    }

    private void increment(String key) {
        totals.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
    }
}
