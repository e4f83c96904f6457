package com.m2m.oauth2.server.error;

public class UnsupportedGrantTypeError extends OAuth2Error {

    public UnsupportedGrantTypeError() {
        this(null);
    }

    public UnsupportedGrantTypeError(String description) {
        super("unsupported_grant_type", description, 400);
    }
}
