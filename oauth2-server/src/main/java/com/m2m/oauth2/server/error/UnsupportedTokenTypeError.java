package com.m2m.oauth2.server.error;

public class UnsupportedTokenTypeError extends OAuth2Error {

    public UnsupportedTokenTypeError() {
        this(null);
    }

    public UnsupportedTokenTypeError(String description) {
        super("unsupported_token_type", description, 400);
    }
}
