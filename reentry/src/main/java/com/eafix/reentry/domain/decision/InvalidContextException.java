package com.eafix.reentry.domain.decision;

import com.eafix.reentry.domain.common.ErrorCode;
import com.eafix.reentry.domain.common.ReentryException;

import java.util.List;

/**
 * Decision context failed structural validation.
 */
public class InvalidContextException extends ReentryException {
    private final String tradeId;

    public InvalidContextException(String tradeId, List<String> problems) {
        super(ErrorCode.INVALID_CONTEXT,
            "Invalid decision context for trade " + tradeId + ": " + String.join("; ", problems), problems);
        this.tradeId = tradeId;
    }

    public String getTradeId() {
        return tradeId;
    }
}
