package com.eafix.reentry.infrastructure.metrics;

import java.time.Duration;
import java.util.Map;

/**
 * Used where a component is built without a metrics backend, e.g. the CLI codec commands.
 */
final class NoopReentryMetrics implements ReentryMetrics {
    static final NoopReentryMetrics INSTANCE = new NoopReentryMetrics();

    private NoopReentryMetrics() {}

    @Override
    public void recordDecision(String status, String action, Duration latency) {}

    @Override
    public void recordSkip(String reason) {}

    @Override
    public void recordResolution(String tier) {}

    @Override
    public void recordResolverExhausted() {}

    @Override
    public void recordLedgerWrite(String recordType, boolean success, Duration latency) {}

    @Override
    public void updateLedgerSequence(String recordType, long fileSeq) {}

    @Override
    public void recordCodecRejection(String errorCode) {}

    @Override
    public Map<String, Object> getMetrics() {
        return Map.of();
    }
}
