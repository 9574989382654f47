package com.eafix.reentry.infrastructure.ledger;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

/**
 * A committed ledger row.
 *
 * @param row every written field by name, in header order
 */
public record LedgerWriteResult(
    long fileSeq,
    String checksum,
    Path file,
    Instant timestamp,
    Map<String, String> row
) {}
