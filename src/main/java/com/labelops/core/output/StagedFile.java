package com.labelops.core.output;

import com.labelops.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * An output fully written to its hidden temporary sibling and not yet renamed onto its final
 * path. A batch stages every output first and commits them together, so a failure part way
 * through leaves no output behind.
 */
public final class StagedFile {
    private static final Logger LOGGER = AppLogger.get();

    private final Path temp;
    private final Path target;

    StagedFile(Path temp, Path target) {
        this.temp = Objects.requireNonNull(temp, "temp");
        this.target = Objects.requireNonNull(target, "target");
    }

    public Path target() {
        return target;
    }

    public Path commit() throws IOException {
        AtomicFiles.moveIntoPlace(temp, target);
        return target;
    }

    public void discard() {
        deleteQuietly(temp);
    }

    /**
     * Commits the files in order. If one rename fails the files already committed are removed
     * and the rest are discarded.
     */
    public static void commitAll(List<StagedFile> staged) throws OutputWriteException {
        List<Path> committed = new ArrayList<>();
        for (int index = 0; index < staged.size(); index++) {
            StagedFile file = staged.get(index);
            try {
                committed.add(file.commit());
            } catch (IOException ex) {
                committed.forEach(StagedFile::deleteQuietly);
                staged.subList(index, staged.size()).forEach(StagedFile::discard);
                throw new OutputWriteException("Failed to move %s into place: %s"
                    .formatted(file.target.getFileName(), ex.getMessage()), ex);
            }
        }
    }

    public static void discardAll(List<StagedFile> staged) {
        staged.forEach(StagedFile::discard);
    }

    static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException cleanup) {
            LOGGER.warning("Could not remove %s: %s".formatted(path.getFileName(), cleanup.getMessage()));
        }
    }
}
