package com.eafix.reentry.infrastructure.ledger;

import com.eafix.reentry.application.lifecycle.ComponentHealth;
import com.eafix.reentry.application.lifecycle.ManagedComponent;
import com.eafix.reentry.application.monitoring.AlertService;
import com.eafix.reentry.domain.ledger.LedgerEntry;
import com.eafix.reentry.domain.ledger.LedgerSchema;
import com.eafix.reentry.domain.monitoring.Alert;
import com.eafix.reentry.domain.monitoring.AlertLevel;
import com.eafix.reentry.infrastructure.metrics.ReentryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.channels.FileChannel;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, checksum-protected CSV ledger.
 *
 * Write protocol for every row:
 * 1. Reserve the next sequence number (under the ledger lock)
 * 2. Build the row and its checksum
 * 3. Write header (new file) or the existing content, then the row, to {@code <file>.tmp}
 * 4. Force the temp file to disk and atomically rename it over the target
 * 5. Commit the sequence number
 *
 * Steps 1-5 run under one lock, so sequence reservation and the write are inseparable:
 * a failed write consumes no number and leaves the target untouched.
 *
 * Files are named {@code <record_type>_<YYYYMMDD>_<HHMMSS>.csv} from the row's UTC timestamp.
 */
public final class IntegrityLedger implements ManagedComponent {
    private static final Logger log = LoggerFactory.getLogger(IntegrityLedger.class);
    private static final String COMPONENT = "ledger";

    private static final DateTimeFormatter FILE_STAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
    static final String TMP_SUFFIX = ".tmp";

    private final Path directory;
    private final boolean resumeSequence;
    private final Clock clock;
    private final ReentryMetrics metrics;
    private final AlertService alertService;

    private final ReentrantLock writeLock = new ReentrantLock();
    private long lastSequence = 0;           // guarded by writeLock
    private volatile long committedRows = 0;
    private volatile String lastFailure;

    public IntegrityLedger(Path directory, Clock clock) {
        this(directory, true, clock, ReentryMetrics.noop(), new AlertService());
    }

    public IntegrityLedger(Path directory,
                           boolean resumeSequence,
                           Clock clock,
                           ReentryMetrics metrics,
                           AlertService alertService) {
        this.directory = directory;
        this.resumeSequence = resumeSequence;
        this.clock = clock;
        this.metrics = metrics;
        this.alertService = alertService;
    }

    @Override
    public String componentName() {
        return COMPONENT;
    }

    /**
     * Create the ledger directory and, if enabled, continue numbering after the highest
     * {@code file_seq} already present in it.
     */
    @Override
    public void initialize() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new LedgerWriteException(directory, "cannot create ledger directory", e);
        }
        if (resumeSequence) {
            long highest = highestExistingSequence();
            writeLock.lock();
            try {
                lastSequence = Math.max(lastSequence, highest);
            } finally {
                writeLock.unlock();
            }
            if (highest > 0) {
                log.info("[Ledger] Resuming sequence after file_seq {}", highest);
            }
        }
    }

    @Override
    public void start() {
        log.info("[Ledger] Writing to {}", directory.toAbsolutePath());
    }

    @Override
    public void stop() {
        log.info("[Ledger] Stopped after {} rows, last file_seq {}", committedRows, lastSequence());
    }

    @Override
    public ComponentHealth healthCheck() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("directory", directory.toString());
        details.put("last_file_seq", lastSequence());
        details.put("rows_written", committedRows);
        if (!Files.isDirectory(directory) || !Files.isWritable(directory)) {
            return ComponentHealth.unhealthy(COMPONENT, "ledger directory not writable: " + directory);
        }
        String failure = lastFailure;
        if (failure != null) {
            return ComponentHealth.degraded(COMPONENT, "last write failed: " + failure, details);
        }
        return ComponentHealth.healthy(COMPONENT, details);
    }

    /**
     * Append one row.
     *
     * @return the committed row with its sequence number and checksum
     * @throws LedgerWriteException if the row could not be made durable
     * @throws IllegalArgumentException if the entry does not supply exactly its schema's fields
     */
    public LedgerWriteResult append(LedgerEntry entry) {
        LedgerSchema schema = entry.schema();
        Map<String, String> values = entry.values();
        checkShape(schema, values);

        long started = System.nanoTime();
        writeLock.lock();
        Path target = null;
        try {
            long fileSeq = lastSequence + 1;
            Instant timestamp = clock.instant().truncatedTo(ChronoUnit.MILLIS);
            target = directory.resolve(fileName(schema.recordType(), timestamp));

            Map<String, String> row = new LinkedHashMap<>();
            row.put(LedgerSchema.FILE_SEQ, Long.toString(fileSeq));
            row.put(LedgerSchema.CHECKSUM, "");
            row.put(LedgerSchema.TIMESTAMP, timestamp.toString());
            row.putAll(values);
            String checksum = LedgerChecksum.compute(row);
            row.put(LedgerSchema.CHECKSUM, checksum);

            List<String> cells = new ArrayList<>(schema.header().size());
            for (String name : schema.header()) {
                cells.add(row.get(name));
            }
            writeAtomically(target, schema, CsvCodec.formatRow(cells));

            lastSequence = fileSeq;
            committedRows++;
            lastFailure = null;
            metrics.recordLedgerWrite(schema.recordType(), true, Duration.ofNanos(System.nanoTime() - started));
            metrics.updateLedgerSequence(schema.recordType(), fileSeq);
            log.debug("[Ledger] Wrote {} file_seq={} checksum={} to {}",
                schema.recordType(), fileSeq, checksum.substring(0, 8), target.getFileName());
            return new LedgerWriteResult(fileSeq, checksum, target, timestamp, Collections.unmodifiableMap(row));
        } catch (IOException e) {
            Path failed = target != null ? target : directory;
            lastFailure = e.getMessage();
            metrics.recordLedgerWrite(schema.recordType(), false, Duration.ofNanos(System.nanoTime() - started));
            log.error("[Ledger] Failed to write {} to {}: {}", schema.recordType(), failed, e.getMessage());
            alertService.sendAlert(Alert.builder()
                .alertType(Alert.LEDGER_WRITE_FAILURE)
                .level(AlertLevel.HIGH)
                .component(COMPONENT)
                .raisedAt(clock.instant())
                .message("Ledger write failed for " + failed + ": " + e.getMessage())
                .detail("record_type", schema.recordType())
                .build());
            throw new LedgerWriteException(failed, e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Highest sequence number committed in this process (or resumed from disk).
     */
    public long lastSequence() {
        writeLock.lock();
        try {
            return lastSequence;
        } finally {
            writeLock.unlock();
        }
    }

    public Path directory() {
        return directory;
    }

    static String fileName(String recordType, Instant timestamp) {
        return recordType + "_" + FILE_STAMP.format(timestamp) + ".csv";
    }

    private void writeAtomically(Path target, LedgerSchema schema, String rowLine) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + TMP_SUFFIX);
        try {
            try (FileChannel channel = FileChannel.open(tmp,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                if (Files.exists(target)) {
                    byte[] existing = Files.readAllBytes(target);
                    checkExistingHeader(target, schema, existing);
                    writeFully(channel, ByteBuffer.wrap(existing));
                } else {
                    writeFully(channel, utf8(CsvCodec.formatRow(schema.header())));
                }
                writeFully(channel, utf8(rowLine));
                channel.force(true);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Ledger] Atomic rename not supported for {}, falling back to replace", target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            discardTemp(tmp);
            throw e;
        }
    }

    private static void checkExistingHeader(Path target, LedgerSchema schema, byte[] existing) throws IOException {
        String content = new String(existing, StandardCharsets.UTF_8);
        int end = content.indexOf('\n');
        String firstLine = (end >= 0 ? content.substring(0, end) : content).replace("\r", "");
        String expected = String.join(",", schema.header());
        if (!firstLine.equals(expected)) {
            throw new IOException("existing file " + target.getFileName() + " has a different header");
        }
        if (!content.isEmpty() && !content.endsWith("\n")) {
            throw new IOException("existing file " + target.getFileName() + " ends with a partial row");
        }
    }

    private static void writeFully(FileChannel channel, ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    private static ByteBuffer utf8(String text) {
        return ByteBuffer.wrap(text.getBytes(StandardCharsets.UTF_8));
    }

    private static void discardTemp(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("[Ledger] Could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }

    private static void checkShape(LedgerSchema schema, Map<String, String> values) {
        Set<String> expected = new HashSet<>(schema.recordFieldNames());
        if (!expected.equals(values.keySet())) {
            Set<String> missing = new HashSet<>(expected);
            missing.removeAll(values.keySet());
            Set<String> extra = new HashSet<>(values.keySet());
            extra.removeAll(expected);
            throw new IllegalArgumentException("Entry for " + schema.recordType()
                + " does not match schema: missing=" + missing + " unexpected=" + extra);
        }
    }

    private long highestExistingSequence() {
        long highest = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.csv")) {
            for (Path file : files) {
                highest = Math.max(highest, highestSequenceIn(file));
            }
        } catch (IOException e) {
            throw new LedgerWriteException(directory, "cannot scan ledger directory", e);
        }
        return highest;
    }

    private static long highestSequenceIn(Path file) throws IOException {
        List<List<String>> rows;
        try {
            rows = CsvCodec.parse(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException | CharacterCodingException e) {
            log.warn("[Ledger] Skipping unparseable file {} while resuming sequence: {}", file, e.getMessage());
            return 0;
        }
        if (rows.isEmpty()) {
            return 0;
        }
        int column = rows.get(0).indexOf(LedgerSchema.FILE_SEQ);
        if (column < 0) {
            return 0;
        }
        long highest = 0;
        for (List<String> row : rows.subList(1, rows.size())) {
            if (column < row.size()) {
                try {
                    highest = Math.max(highest, Long.parseLong(row.get(column)));
                } catch (NumberFormatException e) {
                    log.warn("[Ledger] Ignoring non-numeric file_seq '{}' in {}", row.get(column), file);
                }
            }
        }
        return highest;
    }
}
