package com.eafix.reentry.infrastructure.metrics;

import java.time.Duration;
import java.util.Map;

/**
 * Re-entry metrics interface for monitoring and alerting.
 *
 * Implementations can publish to Prometheus or any other backend; the core only
 * records, it never serves the metrics itself.
 *
 * Key metrics:
 * - Decisions processed, by status and action
 * - Skips by reason
 * - Resolutions by tier, resolver exhaustions
 * - Ledger writes, write latency and current sequence
 * - Identifier codec rejections
 */
public interface ReentryMetrics {

    /**
     * Record a completed decision.
     *
     * @param status Response status (accepted, skipped)
     * @param action Re-entry action, or "none" for skips
     * @param latency End-to-end processing time
     */
    void recordDecision(String status, String action, Duration latency);

    /**
     * Record an eligibility skip.
     *
     * @param reason Machine-readable skip reason
     */
    void recordSkip(String reason);

    /**
     * Record a resolver result.
     *
     * @param tier Tier that produced the match
     */
    void recordResolution(String tier);

    /**
     * Record that no tier matched and the emergency fallback was used.
     */
    void recordResolverExhausted();

    /**
     * Record a ledger append.
     *
     * @param recordType Ledger record type
     * @param success Whether the row was committed
     * @param latency Time spent in the write
     */
    void recordLedgerWrite(String recordType, boolean success, Duration latency);

    /**
     * Update the last committed ledger sequence number.
     */
    void updateLedgerSequence(String recordType, long fileSeq);

    /**
     * Record an identifier rejected by the codec.
     *
     * @param errorCode Reason string of the rejection
     */
    void recordCodecRejection(String errorCode);

    /**
     * Aggregated counters for status reporting.
     */
    Map<String, Object> getMetrics();

    /**
     * Metrics sink that records nothing.
     */
    static ReentryMetrics noop() {
        return NoopReentryMetrics.INSTANCE;
    }
}
