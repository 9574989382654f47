package com.eafix.reentry.infrastructure.ledger;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of verifying one ledger file.
 *
 * A file with any violation should be quarantined by whoever invoked the validator;
 * the validator itself never modifies files.
 */
public record ValidationReport(
    Path file,
    String recordType,      // null when it could not be detected
    int totalRows,
    int validRows,
    int invalidRows,
    List<LedgerViolation> violations
) {
    public ValidationReport {
        violations = List.copyOf(violations);
    }

    public boolean passed() {
        return violations.isEmpty();
    }

    public boolean quarantine() {
        return !passed();
    }

    public long count(LedgerViolation.Kind kind) {
        return violations.stream().filter(v -> v.kind() == kind).count();
    }

    public String summary() {
        return String.format("%s: %s (%d rows, %d valid, %d invalid, %d violations)",
            file.getFileName(), passed() ? "PASS" : "FAIL", totalRows, validRows, invalidRows, violations.size());
    }
}
