package com.m2m.oauth2.server;

import java.time.Instant;

/**
 * A token as persisted by a {@link TokenStore}.
 */
public interface OAuth2Token {

    String accessToken();

    String refreshToken();

    String clientId();

    /** {@code null} for tokens issued to the client itself. */
    String userId();

    String scope();

    Instant issuedAt();

    long expiresIn();

    boolean revoked();

    default boolean checkClient(Client client) {
        return client != null && client.clientId().equals(clientId());
    }
}
