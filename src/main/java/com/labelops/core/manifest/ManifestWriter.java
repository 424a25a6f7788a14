package com.labelops.core.manifest;

import com.labelops.core.output.AtomicFiles;

import java.io.IOException;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Persists batch manifests as indented JSON, one file per batch.
 */
public final class ManifestWriter {
    private static final Pattern UNSAFE_FILENAME_CHARS = Pattern.compile("[^A-Za-z0-9_.-]");

    public Path write(BatchManifest manifest, Path directory) throws ManifestWriteException {
        Objects.requireNonNull(manifest, "manifest");
        Objects.requireNonNull(directory, "directory");
        Path target = directory.resolve(fileName(manifest));
        try {
            AtomicFiles.writeString(target, manifest.toJson().toString(2));
            return target;
        } catch (IOException ex) {
            throw new ManifestWriteException("Failed to write manifest " + target.getFileName(), ex);
        }
    }

    /**
     * {@code <client>_<YYYY-MM-DD>_<batch id>.manifest.json}, dated in UTC.
     */
    static String fileName(BatchManifest manifest) {
        String date = manifest.createdUtc().atZone(ZoneOffset.UTC).toLocalDate().toString();
        String client = UNSAFE_FILENAME_CHARS.matcher(manifest.clientId().trim().replace(' ', '_')).replaceAll("_");
        if (client.isEmpty()) {
            client = "client";
        }
        return "%s_%s_%s.manifest.json".formatted(client, date, manifest.batchId());
    }
}
