package com.labelops.integration.telegram;

import com.labelops.core.output.AtomicFiles;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Drops routed chat text into a client inbox as {@code telegram_<yyyyMMdd_HHmmss>_<chatId>.txt}.
 * The file appears under its final name only once fully written.
 */
public final class InboxWriter {
    private static final DateTimeFormatter STAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Clock clock;

    public InboxWriter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized Path write(Path inbox, long chatId, String content) throws IOException {
        Files.createDirectories(inbox);
        String stem = "telegram_%s_%d".formatted(STAMP.format(clock.instant()), chatId);
        Path target = inbox.resolve(stem + ".txt");
        for (int n = 2; Files.exists(target); n++) {
            target = inbox.resolve(stem + "_" + n + ".txt");
        }
        Path temp = AtomicFiles.tempSibling(target);
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            AtomicFiles.moveIntoPlace(temp, target);
        } catch (IOException ex) {
            Files.deleteIfExists(temp);
            throw ex;
        }
        return target;
    }
}
