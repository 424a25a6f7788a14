package com.labelops.cli;

/**
 * Invalid command line.
 */
public class UsageException extends Exception {

    public UsageException(String message) {
        super(message);
    }
}
