package com.labelops.integration.telegram;

import com.labelops.core.output.AtomicFiles;
import com.labelops.logging.AppLogger;

import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * JSON file backing the chat allowlist. A missing file is created empty with instructions; a
 * malformed file is treated as empty and left untouched for the operator to fix.
 */
public final class AllowlistStore {
    private static final Logger LOGGER = AppLogger.get();

    private final Path file;

    public AllowlistStore(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() {
        return file;
    }

    public synchronized AllowlistConfig load() throws IOException {
        if (!Files.exists(file)) {
            LOGGER.info("Creating empty Telegram allowlist at " + file);
            AtomicFiles.writeString(file, AllowlistConfig.empty().toJson().toString(2));
            return AllowlistConfig.empty();
        }
        String content = Files.readString(file, StandardCharsets.UTF_8);
        try {
            return AllowlistConfig.fromJson(new JSONObject(content));
        } catch (JSONException ex) {
            LOGGER.severe("Telegram allowlist %s is malformed, treating it as empty: %s"
                .formatted(file.getFileName(), ex.getMessage()));
            return AllowlistConfig.empty();
        }
    }

    public synchronized void save(AllowlistConfig config) throws IOException {
        AtomicFiles.writeString(file, config.toJson().toString(2));
    }
}
