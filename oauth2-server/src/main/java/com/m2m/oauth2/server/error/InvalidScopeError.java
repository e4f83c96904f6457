package com.m2m.oauth2.server.error;

public class InvalidScopeError extends OAuth2Error {

    public InvalidScopeError() {
        this(null);
    }

    public InvalidScopeError(String description) {
        super("invalid_scope", description, 400);
    }
}
