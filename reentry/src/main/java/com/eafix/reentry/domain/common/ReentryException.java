package com.eafix.reentry.domain.common;

import java.util.List;

/**
 * Base class for every error raised by the re-entry core.
 *
 * Carries an {@link ErrorCode} plus the individual human-readable problems that
 * caused it, so a caller can show all of them at once instead of the first one.
 */
public abstract class ReentryException extends RuntimeException {

    private final ErrorCode errorCode;
    private final List<String> problems;

    protected ReentryException(ErrorCode errorCode, String message) {
        this(errorCode, message, List.of(), null);
    }

    protected ReentryException(ErrorCode errorCode, String message, List<String> problems) {
        this(errorCode, message, problems, null);
    }

    protected ReentryException(ErrorCode errorCode, String message, List<String> problems, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.problems = problems != null ? List.copyOf(problems) : List.of();
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Stable reason string suitable for operator display and JSON responses.
     */
    public String reason() {
        return errorCode.reason();
    }

    public List<String> getProblems() {
        return problems;
    }
}
