package com.labelops.daemon;

import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Comparator;
import java.util.Objects;

/**
 * A settled inbox file waiting for the worker.
 */
record PendingFile(String clientId, Path path, FileTime modified) {
    static final Comparator<PendingFile> ARRIVAL_ORDER = Comparator
        .comparing(PendingFile::modified)
        .thenComparing(file -> file.path().getFileName().toString());

    PendingFile {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(modified, "modified");
    }
}
