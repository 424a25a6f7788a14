package com.labelops.core.ai;

/**
 * Raised when the correction service cannot answer: not configured, unreachable, timed out or
 * returned output that could not be read.
 */
public class CorrectorUnavailableException extends Exception {

    public CorrectorUnavailableException(String message) {
        super(message);
    }

    public CorrectorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
