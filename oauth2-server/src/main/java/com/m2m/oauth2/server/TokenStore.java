package com.m2m.oauth2.server;

import com.m2m.oauth2.server.token.BearerToken;

import java.util.Optional;

/**
 * Persistence of issued tokens.
 */
public interface TokenStore {

    void save(BearerToken token, Client client, User user);

    /**
     * @param tokenTypeHint {@code access_token}, {@code refresh_token} or {@code null} to search both
     */
    Optional<OAuth2Token> find(String token, String tokenTypeHint);

    /**
     * Marks the token revoked. Revoking a revoked token is a no-op.
     *
     * @return {@code true} only for the one caller that moved the token from live to revoked
     */
    boolean revoke(OAuth2Token token);
}
