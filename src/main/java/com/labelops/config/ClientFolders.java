package com.labelops.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Resolved absolute locations of a client's working folders.
 */
public record ClientFolders(Path inTxt, Path readyXlsx, Path archive, Path trackingOut, Path failures) {

    public ClientFolders {
        Objects.requireNonNull(inTxt, "inTxt");
        Objects.requireNonNull(readyXlsx, "readyXlsx");
        Objects.requireNonNull(archive, "archive");
        Objects.requireNonNull(trackingOut, "trackingOut");
        Objects.requireNonNull(failures, "failures");
    }

    public Path get(FolderKind kind) {
        return switch (kind) {
            case IN_TXT -> inTxt;
            case READY_XLSX -> readyXlsx;
            case ARCHIVE -> archive;
            case TRACKING_OUT -> trackingOut;
            case FAILURES -> failures;
        };
    }

    public List<Path> all() {
        return List.of(inTxt, readyXlsx, archive, trackingOut, failures);
    }

    public void createAll() throws IOException {
        for (Path folder : all()) {
            Files.createDirectories(folder);
        }
    }
}
