package com.eafix.reentry.infrastructure.ledger;

/**
 * One problem found in a ledger file.
 *
 * @param row   1-based data row, or 0 for file and header level problems
 * @param field column name, null when not tied to one column
 */
public record LedgerViolation(
    Kind kind,
    int row,
    String field,
    String message
) {
    public enum Kind {
        FILENAME,
        UNKNOWN_RECORD_TYPE,
        ENCODING,
        HEADER,
        SHAPE,
        TYPE,
        CHECKSUM_FORMAT,
        CHECKSUM_MISMATCH,
        SEQUENCE_VIOLATION
    }

    public static LedgerViolation file(Kind kind, String message) {
        return new LedgerViolation(kind, 0, null, message);
    }

    @Override
    public String toString() {
        String where = row > 0 ? "row " + row : "file";
        if (field != null) {
            where = where + " " + field;
        }
        return "[" + kind + "] " + where + ": " + message;
    }
}
