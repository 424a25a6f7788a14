package com.labelops.core.output;

/**
 * Raised when a batch output file cannot be produced. Nothing is left at the final path.
 */
public class OutputWriteException extends Exception {

    public OutputWriteException(String message) {
        super(message);
    }

    public OutputWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
