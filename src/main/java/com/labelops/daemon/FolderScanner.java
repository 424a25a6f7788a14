package com.labelops.daemon;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists inbox text files that have not been modified for the settle period.
 */
final class FolderScanner {
    private final Duration settle;
    private final Clock clock;

    FolderScanner(Duration settle, Clock clock) {
        this.settle = Objects.requireNonNull(settle, "settle");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    List<PendingFile> settledFiles(String clientId, Path inbox, boolean recursive) throws IOException {
        if (!Files.isDirectory(inbox)) {
            return List.of();
        }
        List<Path> candidates;
        try (Stream<Path> stream = recursive ? Files.walk(inbox) : Files.list(inbox)) {
            candidates = stream
                .filter(Files::isRegularFile)
                .filter(FolderScanner::isCandidate)
                .collect(Collectors.toList());
        }

        Instant cutoff = clock.instant().minus(settle);
        List<PendingFile> settled = new ArrayList<>();
        for (Path candidate : candidates) {
            FileTime modified;
            try {
                modified = Files.getLastModifiedTime(candidate);
            } catch (IOException ex) {
                // removed or renamed between listing and stat; seen again on the next poll if it returns
                continue;
            }
            if (!modified.toInstant().isAfter(cutoff)) {
                settled.add(new PendingFile(clientId, candidate, modified));
            }
        }
        settled.sort(PendingFile.ARRIVAL_ORDER);
        return settled;
    }

    /**
     * Accepts {@code .txt} files that are not hidden, partial or editor backups.
     */
    static boolean isCandidate(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return false;
        }
        String lower = name.toString().toLowerCase(Locale.ROOT);
        if (lower.startsWith(".") || lower.startsWith("~") || lower.endsWith("~")) {
            return false;
        }
        if (lower.endsWith(".tmp") || lower.endsWith(".part")) {
            return false;
        }
        return lower.endsWith(".txt") && !lower.endsWith(".error.txt");
    }
}
