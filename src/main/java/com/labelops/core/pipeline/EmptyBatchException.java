package com.labelops.core.pipeline;

/**
 * Raised when no record of a batch survives parsing and validation.
 */
public class EmptyBatchException extends Exception {
    private final int parseWarnings;
    private final int validationFailures;

    public EmptyBatchException(String clientId, int parseWarnings, int validationFailures) {
        super("No valid records for %s (%d parse warning(s), %d validation failure(s))"
            .formatted(clientId, parseWarnings, validationFailures));
        this.parseWarnings = parseWarnings;
        this.validationFailures = validationFailures;
    }

    public int getParseWarnings() {
        return parseWarnings;
    }

    public int getValidationFailures() {
        return validationFailures;
    }
}
