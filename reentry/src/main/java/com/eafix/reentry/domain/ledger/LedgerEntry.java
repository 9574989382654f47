package com.eafix.reentry.domain.ledger;

import java.util.Map;

/**
 * Something that can be appended to the ledger.
 *
 * The ledger adds {@code file_seq}, {@code checksum_sha256} and {@code timestamp};
 * {@link #values()} supplies every other field of the schema, already rendered as
 * the exact strings to write.
 */
public interface LedgerEntry {

    LedgerSchema schema();

    Map<String, String> values();
}
