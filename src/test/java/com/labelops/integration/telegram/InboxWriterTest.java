package com.labelops.integration.telegram;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;

class InboxWriterTest {

    @TempDir
    Path inbox;

    private final InboxWriter writer =
        new InboxWriter(Clock.fixed(Instant.parse("2026-10-19T08:30:05Z"), ZoneOffset.UTC));

    @Test
    void namesFilesByTimeAndChat() throws Exception {
        Path written = writer.write(inbox.resolve("IN_TXT"), -1001L, "Jane Doe\n1 Road");

        assertEquals("telegram_20261019_083005_-1001.txt", written.getFileName().toString());
        assertEquals("Jane Doe\n1 Road", Files.readString(written));
    }

    @Test
    void sameSecondGetsNumberedSuffix() throws Exception {
        Path first = writer.write(inbox, 42L, "one");
        Path second = writer.write(inbox, 42L, "two");
        Path third = writer.write(inbox, 42L, "three");

        assertEquals("telegram_20261019_083005_42.txt", first.getFileName().toString());
        assertEquals("telegram_20261019_083005_42_2.txt", second.getFileName().toString());
        assertEquals("telegram_20261019_083005_42_3.txt", third.getFileName().toString());
        try (Stream<Path> files = Files.list(inbox)) {
            assertEquals(3, files.count(), "no temporary files left behind");
        }
    }
}
