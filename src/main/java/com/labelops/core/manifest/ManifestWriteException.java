package com.labelops.core.manifest;

/**
 * Raised when a batch manifest cannot be written. Batch outputs are kept regardless.
 */
public class ManifestWriteException extends Exception {

    public ManifestWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
