package com.m2m.oauth2.server.error;

public class InvalidGrantError extends OAuth2Error {

    public InvalidGrantError() {
        this(null);
    }

    public InvalidGrantError(String description) {
        super("invalid_grant", description, 400);
    }
}
