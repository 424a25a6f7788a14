package com.labelops.daemon;

import com.labelops.core.output.CsvRows;
import com.labelops.logging.AppLogger;
import com.labelops.logging.LogRedactor;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Appends one row per quarantined input to {@code failures.csv} in the log directory so failures
 * can be reviewed without reading the full log.
 */
public final class FailureLedger {
    private static final Logger LOGGER = AppLogger.get();
    static final String FILE_NAME = "failures.csv";
    static final String HEADER = "timestamp_utc,client_id,file_name,quarantined_as,exception_type,message";
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final Path ledgerFile;
    private final Clock clock;

    public FailureLedger(Path logDirectory, Clock clock) {
        this.ledgerFile = Objects.requireNonNull(logDirectory, "logDirectory").resolve(FILE_NAME);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Path file() {
        return ledgerFile;
    }

    public void record(String clientId, Path original, Path quarantined, Exception failure) {
        String message = failure == null ? "" : LogRedactor.redact(failure.getMessage());
        List<String> columns = List.of(
            TIMESTAMP_FORMAT.format(clock.instant()),
            clientId == null ? "" : clientId,
            original == null ? "" : original.getFileName().toString(),
            quarantined == null ? "" : quarantined.getFileName().toString(),
            failure == null ? "" : failure.getClass().getName(),
            message);
        writeRow(columns);
    }

    private void writeRow(List<String> columns) {
        synchronized (FailureLedger.class) {
            try {
                if (ledgerFile.getParent() != null) {
                    Files.createDirectories(ledgerFile.getParent());
                }
                boolean fileExists = Files.exists(ledgerFile);
                try (BufferedWriter writer = Files.newBufferedWriter(
                    ledgerFile,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
                )) {
                    if (!fileExists) {
                        writer.write(HEADER);
                        writer.newLine();
                    }
                    writer.write(CsvRows.toCsv(columns));
                    writer.newLine();
                }
            } catch (IOException ioEx) {
                LOGGER.warning("Failed to write failure ledger: " + ioEx.getMessage());
            }
        }
    }
}
