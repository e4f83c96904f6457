package com.m2m.oauth2.server.error;

public class InvalidRequestError extends OAuth2Error {

    public InvalidRequestError() {
        this(null);
    }

    public InvalidRequestError(String description) {
        super("invalid_request", description, 400);
    }
}
