package com.eafix.reentry.domain.hybrid;

import com.eafix.reentry.domain.common.ErrorCode;
import com.eafix.reentry.domain.common.ReentryException;

import java.util.List;

/**
 * One or more identifier components are not legal in the vocabulary.
 */
public class InvalidComponentException extends ReentryException {

    public InvalidComponentException(List<String> reasons) {
        super(ErrorCode.INVALID_COMPONENT, "Invalid hybrid ID components: " + String.join("; ", reasons), reasons);
    }
}
