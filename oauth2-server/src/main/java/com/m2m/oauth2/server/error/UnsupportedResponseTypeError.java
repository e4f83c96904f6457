package com.m2m.oauth2.server.error;

public class UnsupportedResponseTypeError extends OAuth2Error {

    public UnsupportedResponseTypeError() {
        this(null);
    }

    public UnsupportedResponseTypeError(String description) {
        super("unsupported_response_type", description, 400);
    }
}
