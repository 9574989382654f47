package com.eafix.reentry.domain.hybrid;

import com.eafix.reentry.domain.common.ErrorCode;
import com.eafix.reentry.domain.common.ReentryException;

import java.util.List;

/**
 * Text cannot be segmented into a hybrid ID.
 */
public class MalformedIdentifierException extends ReentryException {
    private final String text;

    public MalformedIdentifierException(String text, String detail) {
        super(ErrorCode.MALFORMED_IDENTIFIER, "Malformed hybrid ID '" + text + "': " + detail, List.of(detail));
        this.text = text;
    }

    public String getText() {
        return text;
    }
}
