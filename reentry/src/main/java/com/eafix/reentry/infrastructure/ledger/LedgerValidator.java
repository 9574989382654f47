package com.eafix.reentry.infrastructure.ledger;

import com.eafix.reentry.domain.ledger.FieldType;
import com.eafix.reentry.domain.ledger.LedgerField;
import com.eafix.reentry.domain.ledger.LedgerSchema;
import com.eafix.reentry.infrastructure.ledger.LedgerViolation.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Independent verifier for ledger files. Trusts nothing the writer did: the record
 * type comes from the file name, the checksum is recomputed from the row, and every
 * violation is reported rather than the first one.
 *
 * Checks:
 * - File name follows {@code <record_type>_<YYYYMMDD>_<HHMMSS>.csv}
 * - Header: missing, unexpected, repeated and out-of-order columns
 * - Row shape and field types
 * - Checksum format and value
 * - {@code file_seq} strictly increasing row over row
 *
 * Read-only; thread-safe.
 */
public final class LedgerValidator {
    private static final Logger log = LoggerFactory.getLogger(LedgerValidator.class);

    private static final Pattern FILE_NAME = Pattern.compile("^[a-z_]+_\\d{8}_\\d{6}\\.csv$");

    private final SchemaRegistry schemas;

    public LedgerValidator() {
        this(SchemaRegistry.defaults());
    }

    public LedgerValidator(SchemaRegistry schemas) {
        this.schemas = schemas;
    }

    /**
     * Verify one file.
     *
     * @throws UncheckedIOException if the file cannot be read at all
     */
    public ValidationReport verify(Path file) {
        List<LedgerViolation> violations = new ArrayList<>();
        String fileName = file.getFileName().toString();

        if (fileName.endsWith(IntegrityLedger.TMP_SUFFIX)) {
            violations.add(LedgerViolation.file(Kind.FILENAME, "temporary file, write did not complete"));
            return new ValidationReport(file, null, 0, 0, 0, violations);
        }
        if (!FILE_NAME.matcher(fileName).matches()) {
            violations.add(LedgerViolation.file(Kind.FILENAME,
                "name does not follow <record_type>_<YYYYMMDD>_<HHMMSS>.csv"));
        }
        Optional<LedgerSchema> detected = schemas.detect(fileName);
        if (detected.isEmpty()) {
            violations.add(LedgerViolation.file(Kind.UNKNOWN_RECORD_TYPE, "no schema for file " + fileName));
            return new ValidationReport(file, null, 0, 0, 0, violations);
        }
        LedgerSchema schema = detected.get();

        String content;
        try {
            content = decodeUtf8(Files.readAllBytes(file));
        } catch (CharacterCodingException e) {
            violations.add(LedgerViolation.file(Kind.ENCODING, "file is not valid UTF-8"));
            return new ValidationReport(file, schema.recordType(), 0, 0, 0, violations);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }

        List<List<String>> rows;
        try {
            rows = CsvCodec.parse(content);
        } catch (IllegalArgumentException e) {
            violations.add(LedgerViolation.file(Kind.SHAPE, e.getMessage()));
            return new ValidationReport(file, schema.recordType(), 0, 0, 0, violations);
        }
        if (rows.isEmpty()) {
            violations.add(LedgerViolation.file(Kind.HEADER, "file is empty"));
            return new ValidationReport(file, schema.recordType(), 0, 0, 0, violations);
        }

        List<String> header = rows.get(0);
        checkHeader(schema, header, violations);

        List<List<String>> data = rows.subList(1, rows.size());
        int invalid = 0;
        Long previousSeq = null;
        for (int i = 0; i < data.size(); i++) {
            int rowNumber = i + 1;
            int before = violations.size();
            List<String> cells = data.get(i);

            if (cells.size() != header.size()) {
                violations.add(new LedgerViolation(Kind.SHAPE, rowNumber, null,
                    "expected " + header.size() + " cells, found " + cells.size()));
                invalid++;
                continue;
            }
            Map<String, String> row = new LinkedHashMap<>();
            for (int c = 0; c < header.size(); c++) {
                row.putIfAbsent(header.get(c), cells.get(c));
            }

            checkTypes(schema, row, rowNumber, violations);
            checkChecksum(row, rowNumber, violations);
            previousSeq = checkSequence(row, rowNumber, previousSeq, violations);

            if (violations.size() > before) {
                invalid++;
            }
        }

        ValidationReport report = new ValidationReport(file, schema.recordType(),
            data.size(), data.size() - invalid, invalid, violations);
        if (report.passed()) {
            log.debug("[Validator] {}", report.summary());
        } else {
            log.warn("[Validator] {}", report.summary());
        }
        return report;
    }

    /**
     * Verify every {@code .csv} file in a directory, plus report any leftover {@code .tmp} files.
     */
    public List<ValidationReport> verifyDirectory(Path directory) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory,
                p -> Files.isRegularFile(p) && (p.toString().endsWith(".csv") || p.toString().endsWith(IntegrityLedger.TMP_SUFFIX)))) {
            stream.forEach(files::add);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + directory, e);
        }
        files.sort(null);
        List<ValidationReport> reports = new ArrayList<>();
        for (Path file : files) {
            reports.add(verify(file));
        }
        return reports;
    }

    private static void checkHeader(LedgerSchema schema, List<String> header, List<LedgerViolation> violations) {
        List<String> expected = schema.header();
        Set<String> seen = new HashSet<>();
        for (String column : header) {
            if (!seen.add(column)) {
                violations.add(new LedgerViolation(Kind.HEADER, 0, column, "column repeated"));
            } else if (!expected.contains(column)) {
                violations.add(new LedgerViolation(Kind.HEADER, 0, column, "unexpected column"));
            }
        }
        for (String column : expected) {
            if (!seen.contains(column)) {
                violations.add(new LedgerViolation(Kind.HEADER, 0, column, "missing column"));
            }
        }
        List<String> common = header.stream().filter(expected::contains).distinct().toList();
        List<String> expectedPresent = expected.stream().filter(seen::contains).toList();
        if (!common.equals(expectedPresent)) {
            violations.add(LedgerViolation.file(Kind.HEADER, "columns out of order, expected " + expected));
        }
    }

    private static void checkTypes(LedgerSchema schema, Map<String, String> row, int rowNumber,
                                   List<LedgerViolation> violations) {
        for (Map.Entry<String, String> cell : row.entrySet()) {
            // checksum format has its own violation kind
            if (LedgerSchema.CHECKSUM.equals(cell.getKey())) {
                continue;
            }
            Optional<LedgerField> field = schema.field(cell.getKey());
            if (field.isEmpty()) {
                continue;
            }
            field.get().check(cell.getValue())
                .ifPresent(problem -> violations.add(new LedgerViolation(Kind.TYPE, rowNumber, cell.getKey(), problem)));
        }
    }

    private static void checkChecksum(Map<String, String> row, int rowNumber, List<LedgerViolation> violations) {
        String recorded = row.get(LedgerSchema.CHECKSUM);
        if (recorded == null) {
            return;
        }
        if (!FieldType.CHECKSUM.parses(recorded)) {
            violations.add(new LedgerViolation(Kind.CHECKSUM_FORMAT, rowNumber, LedgerSchema.CHECKSUM,
                "expected 64 lowercase hex characters"));
            return;
        }
        String computed = LedgerChecksum.compute(row);
        if (!computed.equals(recorded)) {
            violations.add(new LedgerViolation(Kind.CHECKSUM_MISMATCH, rowNumber, LedgerSchema.CHECKSUM,
                "recorded " + recorded + " but row hashes to " + computed));
        }
    }

    private static Long checkSequence(Map<String, String> row, int rowNumber, Long previous,
                                      List<LedgerViolation> violations) {
        String raw = row.get(LedgerSchema.FILE_SEQ);
        if (raw == null || !FieldType.INTEGER.parses(raw)) {
            // reported by the type check
            return previous;
        }
        long current = Long.parseLong(raw);
        if (previous != null && current <= previous) {
            violations.add(new LedgerViolation(Kind.SEQUENCE_VIOLATION, rowNumber, LedgerSchema.FILE_SEQ,
                "file_seq " + current + " not greater than previous " + previous));
        }
        return current;
    }

    private static String decodeUtf8(byte[] bytes) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(bytes))
            .toString();
    }
}
