package com.labelops.daemon;

import com.labelops.logging.AppLogger;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Moves an input that failed processing into the client's failures folder and writes a
 * {@code <name>.error.txt} sibling with the full diagnostic.
 */
public final class FailureHandler {
    private static final Logger LOGGER = AppLogger.get();

    private final FailureLedger ledger;
    private final Clock clock;

    public FailureHandler(FailureLedger ledger, Clock clock) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @return where the input now lives
     * @throws IOException when the input cannot be moved; the diagnostic is still attempted
     */
    public Path quarantine(String clientId, Path input, Path failuresDir, Exception cause) throws IOException {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(failuresDir, "failuresDir");
        Path quarantined = Files.exists(input)
            ? FileMoves.moveUnique(input, failuresDir, clock)
            : FileMoves.uniqueDestination(failuresDir, input.getFileName().toString(), clock);

        Path errorFile = quarantined.resolveSibling(FileMoves.stem(quarantined) + ".error.txt");
        Files.createDirectories(failuresDir);
        Files.writeString(errorFile, diagnostic(clientId, input, cause), StandardCharsets.UTF_8);
        ledger.record(clientId, input, quarantined, cause);
        LOGGER.warning("Quarantined %s for %s as %s".formatted(input.getFileName(), clientId, quarantined.getFileName()));
        return quarantined;
    }

    private String diagnostic(String clientId, Path input, Exception cause) {
        StringWriter trace = new StringWriter();
        if (cause != null) {
            cause.printStackTrace(new PrintWriter(trace));
        }
        return """
            time_utc: %s
            client_id: %s
            input: %s
            error: %s

            %s""".formatted(
            clock.instant(),
            clientId,
            input.getFileName(),
            cause == null ? "unknown" : cause.getClass().getName() + ": " + cause.getMessage(),
            trace);
    }
}
