package com.m2m.oauth2.jose;

public class InvalidKeyMaterialException extends JoseException {

    public InvalidKeyMaterialException(String message) {
        super(message);
    }

    public InvalidKeyMaterialException(String message, Throwable cause) {
        super(message, cause);
    }
}
