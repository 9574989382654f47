package com.eafix.reentry.domain.hybrid;

import com.eafix.reentry.domain.common.ErrorCode;
import com.eafix.reentry.domain.common.ReentryException;

/**
 * Suffix is not exactly six lowercase alphanumeric characters.
 */
public class InvalidSuffixException extends ReentryException {
    private final String suffix;

    public InvalidSuffixException(String suffix) {
        super(ErrorCode.INVALID_SUFFIX, "Invalid suffix '" + suffix + "': expected 6 characters [a-z0-9]");
        this.suffix = suffix;
    }

    public String getSuffix() {
        return suffix;
    }
}
