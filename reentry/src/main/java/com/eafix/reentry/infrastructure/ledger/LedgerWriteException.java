package com.eafix.reentry.infrastructure.ledger;

import com.eafix.reentry.domain.common.ErrorCode;
import com.eafix.reentry.domain.common.ReentryException;

import java.nio.file.Path;
import java.util.List;

/**
 * A row could not be committed. Nothing was written and no sequence number was consumed;
 * retrying is up to the caller.
 */
public class LedgerWriteException extends ReentryException {
    private final Path file;

    public LedgerWriteException(Path file, String message, Throwable cause) {
        super(ErrorCode.WRITE_FAILURE, "Ledger write to " + file + " failed: " + message, List.of(message), cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
