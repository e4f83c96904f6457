package com.m2m.oauth2.server.error;

public class UnauthorizedClientError extends OAuth2Error {

    public UnauthorizedClientError() {
        this(null);
    }

    public UnauthorizedClientError(String description) {
        super("unauthorized_client", description, 400);
    }
}
