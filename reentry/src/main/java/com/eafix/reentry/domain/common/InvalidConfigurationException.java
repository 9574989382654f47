package com.eafix.reentry.domain.common;

import java.util.List;

/**
 * Settings or a data file failed validation at load time.
 */
public class InvalidConfigurationException extends ReentryException {

    public InvalidConfigurationException(String message) {
        super(ErrorCode.INVALID_CONFIGURATION, message);
    }

    public InvalidConfigurationException(String message, List<String> problems) {
        super(ErrorCode.INVALID_CONFIGURATION, message, problems);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(ErrorCode.INVALID_CONFIGURATION, message, List.of(), cause);
    }
}
