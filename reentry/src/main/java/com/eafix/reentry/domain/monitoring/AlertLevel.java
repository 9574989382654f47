package com.eafix.reentry.domain.monitoring;

/**
 * Alert severity, highest first.
 */
public enum AlertLevel {
    /** Decision made on EMERGENCY parameters: the parameter file has a gap. */
    CRITICAL,
    /** A decision was not recorded. */
    HIGH,
    /** Rejected reload; the previous parameter sets stay active. */
    MEDIUM,
    INFO
}
