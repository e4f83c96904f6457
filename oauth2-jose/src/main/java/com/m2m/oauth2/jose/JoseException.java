package com.m2m.oauth2.jose;

/**
 * Base class for failures raised by the algorithm engine.
 */
public class JoseException extends RuntimeException {

    public JoseException(String message) {
        super(message);
    }

    public JoseException(String message, Throwable cause) {
        super(message, cause);
    }
}
