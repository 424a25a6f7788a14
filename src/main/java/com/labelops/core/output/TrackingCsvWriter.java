package com.labelops.core.output;

import com.labelops.core.parse.AddressRecord;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Writes the per-batch tracking CSV that operators fill in once labels are bought.
 */
public final class TrackingCsvWriter {
    static final List<String> HEADER =
        List.of("full_name", "postcode", "service", "weight_kg", "reference", "notes", "ai_flag");

    public Path write(List<AddressRecord> records, Path trackingDir, String fileName) throws OutputWriteException {
        StagedFile staged = stage(records, trackingDir, fileName);
        StagedFile.commitAll(List.of(staged));
        return staged.target();
    }

    public StagedFile stage(List<AddressRecord> records, Path trackingDir, String fileName) throws OutputWriteException {
        Objects.requireNonNull(records, "records");
        Path target = trackingDir.resolve(fileName);
        Path temp = AtomicFiles.tempSibling(target);
        try {
            Files.createDirectories(trackingDir);
            try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                writer.write(CsvRows.toCsv(HEADER));
                writer.newLine();
                for (AddressRecord record : records) {
                    writer.write(CsvRows.toCsv(List.of(
                        record.fullName(),
                        record.postcode(),
                        record.service(),
                        record.weightKg() == null ? "" : String.valueOf(record.weightKg()),
                        record.reference(),
                        record.notes(),
                        record.aiFlagged() ? "Yes" : "No")));
                    writer.newLine();
                }
            }
            return new StagedFile(temp, target);
        } catch (IOException ex) {
            StagedFile.deleteQuietly(temp);
            throw new OutputWriteException("Failed to write tracking CSV %s: %s".formatted(target.getFileName(), ex.getMessage()), ex);
        }
    }
}
