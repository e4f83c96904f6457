package com.m2m.oauth2.server.error;

public class AccessDeniedError extends OAuth2Error {

    public AccessDeniedError() {
        this(null);
    }

    public AccessDeniedError(String description) {
        super("access_denied", description, 400);
    }
}
