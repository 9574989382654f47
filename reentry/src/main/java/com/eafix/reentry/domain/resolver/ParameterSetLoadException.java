package com.eafix.reentry.domain.resolver;

import com.eafix.reentry.domain.common.ErrorCode;
import com.eafix.reentry.domain.common.ReentryException;

import java.util.List;

/**
 * A parameter set file was rejected. Nothing from it is installed.
 */
public class ParameterSetLoadException extends ReentryException {

    public ParameterSetLoadException(String source, List<String> problems) {
        super(ErrorCode.PARAMETER_SET_LOAD,
            "Rejected parameter sets from " + source + ": " + String.join("; ", problems), problems);
    }

    public ParameterSetLoadException(String source, String problem, Throwable cause) {
        super(ErrorCode.PARAMETER_SET_LOAD,
            "Rejected parameter sets from " + source + ": " + problem, List.of(problem), cause);
    }
}
