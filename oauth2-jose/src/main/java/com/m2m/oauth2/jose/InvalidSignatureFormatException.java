package com.m2m.oauth2.jose;

/**
 * Signature bytes do not have the shape the algorithm requires.
 */
public class InvalidSignatureFormatException extends JoseException {

    public InvalidSignatureFormatException(String message) {
        super(message);
    }
}
