package com.labelops.daemon;

import com.labelops.core.output.AtomicFiles;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Moves processed inputs without overwriting earlier ones of the same name.
 */
final class FileMoves {
    private static final DateTimeFormatter SUFFIX =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private FileMoves() {
    }

    static Path moveUnique(Path source, Path directory, Clock clock) throws IOException {
        Files.createDirectories(directory);
        Path destination = uniqueDestination(directory, source.getFileName().toString(), clock);
        AtomicFiles.moveIntoPlace(source, destination);
        return destination;
    }

    /**
     * {@code name.txt}, else {@code name_<timestamp>.txt}, else {@code name_<timestamp>_<n>.txt}.
     */
    static Path uniqueDestination(Path directory, String fileName, Clock clock) {
        Path plain = directory.resolve(fileName);
        if (!Files.exists(plain)) {
            return plain;
        }
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";
        String stamped = stem + "_" + SUFFIX.format(clock.instant());
        Path candidate = directory.resolve(stamped + extension);
        for (int n = 2; Files.exists(candidate); n++) {
            candidate = directory.resolve(stamped + "_" + n + extension);
        }
        return candidate;
    }

    static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
