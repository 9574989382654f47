package com.eafix.reentry.domain.hybrid;

import com.eafix.reentry.domain.common.ErrorCode;
import com.eafix.reentry.domain.common.ReentryException;

/**
 * Generation has no chain position.
 */
public class InvalidGenerationException extends ReentryException {
    private final int generation;

    public InvalidGenerationException(int generation) {
        super(ErrorCode.INVALID_GENERATION, "Invalid generation " + generation + ": expected 1, 2 or 3");
        this.generation = generation;
    }

    public int getGeneration() {
        return generation;
    }
}
