package com.m2m.oauth2.server.error;

import lombok.Getter;

import java.util.Map;

/**
 * An RFC 6749 error. Thrown inside grants and endpoints, rendered into a response by
 * {@link com.m2m.oauth2.server.AuthorizationServer}; never escapes the server.
 */
@Getter
public class OAuth2Error extends RuntimeException {
    private final String error;
    private final String description;
    private final int status;
    private String redirectUri;
    private String state;
    private boolean fragment;

    public OAuth2Error(String error, String description, int status) {
        super(description == null ? error : error + ": " + description);
        this.error = error;
        this.description = description;
        this.status = status;
    }

    /**
     * Marks this error to be delivered to the client's redirect URI instead of a JSON body.
     */
    public OAuth2Error redirectTo(String redirectUri, String state, boolean fragment) {
        this.redirectUri = redirectUri;
        this.state = state;
        this.fragment = fragment;
        return this;
    }

    public boolean isRedirect() {
        return redirectUri != null;
    }

    /** Extra response headers. */
    public Map<String, String> headers() {
        return Map.of();
    }
}
