package com.labelops.config;

/**
 * Raised when a request names a client that the current configuration does not define.
 */
public class UnknownClientException extends Exception {
    private final String clientId;

    public UnknownClientException(String clientId) {
        super("Client ID not found: " + clientId);
        this.clientId = clientId;
    }

    public String getClientId() {
        return clientId;
    }
}
