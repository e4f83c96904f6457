package com.m2m.oauth2.server.error;

import java.util.Map;

/**
 * Client authentication failed. Carries a {@code WWW-Authenticate} challenge when the client
 * tried HTTP Basic, as RFC 6749 section 5.2 requires.
 */
public class InvalidClientError extends OAuth2Error {
    private final boolean basicChallenge;

    public InvalidClientError(String description) {
        this(description, false);
    }

    public InvalidClientError(String description, boolean basicChallenge) {
        super("invalid_client", description, 401);
        this.basicChallenge = basicChallenge;
    }

    @Override
    public Map<String, String> headers() {
        if (!basicChallenge) return Map.of();
        return Map.of("WWW-Authenticate", "Basic error=\"invalid_client\"");
    }
}
