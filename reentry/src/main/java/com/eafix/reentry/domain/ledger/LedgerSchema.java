package com.eafix.reentry.domain.ledger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Column layout of one ledger record type.
 *
 * Every record type starts with {@code file_seq, checksum_sha256, timestamp}
 * followed by its own fields in declared order.
 */
public final class LedgerSchema {
    public static final String FILE_SEQ = "file_seq";
    public static final String CHECKSUM = "checksum_sha256";
    public static final String TIMESTAMP = "timestamp";

    private final String recordType;
    private final List<LedgerField> fields;
    private final Map<String, LedgerField> byName;
    private final List<String> header;

    private LedgerSchema(String recordType, List<LedgerField> fields) {
        this.recordType = recordType;
        this.fields = List.copyOf(fields);
        Map<String, LedgerField> index = new LinkedHashMap<>();
        for (LedgerField field : fields) {
            if (index.put(field.name(), field) != null) {
                throw new IllegalArgumentException("Duplicate field " + field.name() + " in " + recordType);
            }
        }
        this.byName = Collections.unmodifiableMap(index);
        this.header = List.copyOf(index.keySet());
    }

    /**
     * @param recordType Record type, also the filename prefix
     * @param recordFields Fields after the three common ones
     */
    public static LedgerSchema of(String recordType, LedgerField... recordFields) {
        List<LedgerField> all = new ArrayList<>();
        all.add(new LedgerField(FILE_SEQ, FieldType.INTEGER, false, v -> Long.parseLong(v) >= 1, ">= 1"));
        all.add(LedgerField.of(CHECKSUM, FieldType.CHECKSUM));
        all.add(LedgerField.of(TIMESTAMP, FieldType.TIMESTAMP));
        all.addAll(List.of(recordFields));
        return new LedgerSchema(recordType, all);
    }

    public String recordType() {
        return recordType;
    }

    public List<LedgerField> fields() {
        return fields;
    }

    public List<String> header() {
        return header;
    }

    /**
     * Fields a {@link LedgerEntry} must supply: everything except the three common ones.
     */
    public List<String> recordFieldNames() {
        return header.subList(3, header.size());
    }

    public Optional<LedgerField> field(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    @Override
    public String toString() {
        return recordType + header;
    }
}
