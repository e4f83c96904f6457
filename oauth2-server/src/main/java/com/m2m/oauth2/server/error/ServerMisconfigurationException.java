package com.m2m.oauth2.server.error;

/**
 * The server cannot start with the supplied configuration.
 */
public class ServerMisconfigurationException extends RuntimeException {

    public ServerMisconfigurationException(String message) {
        super(message);
    }

    public ServerMisconfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
