package com.eafix.reentry.domain.common;

/**
 * Machine-readable error codes for every failure the core surfaces to a caller.
 *
 * The {@link #reason()} string is stable and is what operators and downstream
 * consumers see; do not rename existing values.
 */
public enum ErrorCode {
    INVALID_COMPONENT("invalid_component"),
    INVALID_SUFFIX("invalid_suffix"),
    MALFORMED_IDENTIFIER("malformed_identifier"),
    INVALID_GENERATION("invalid_generation"),
    INVALID_CONTEXT("invalid_context"),
    PARAMETER_SET_LOAD("parameter_set_load_failed"),
    WRITE_FAILURE("ledger_write_failure"),
    INVALID_CONFIGURATION("invalid_configuration");

    private final String reason;

    ErrorCode(String reason) {
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
