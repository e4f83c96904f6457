package com.m2m.oauth2.server.token;

import com.m2m.oauth2.server.Client;
import com.m2m.oauth2.server.User;

import java.util.Objects;

/**
 * Assembles {@link BearerToken}s from pluggable value and expiry strategies. Has no side effects
 * besides generating values; persisting the token is the caller's job.
 */
public class BearerTokenGenerator {
    private final TokenValueGenerator accessTokenGenerator;
    private final TokenValueGenerator refreshTokenGenerator;
    private final ExpiresInResolver expiresInResolver;

    /**
     * @param refreshTokenGenerator {@code null} disables refresh tokens
     */
    public BearerTokenGenerator(TokenValueGenerator accessTokenGenerator,
                                TokenValueGenerator refreshTokenGenerator,
                                ExpiresInResolver expiresInResolver) {
        this.accessTokenGenerator = Objects.requireNonNull(accessTokenGenerator, "accessTokenGenerator");
        this.refreshTokenGenerator = refreshTokenGenerator;
        this.expiresInResolver = Objects.requireNonNull(expiresInResolver, "expiresInResolver");
    }

    /** Random access tokens, no refresh tokens, default expiry table. */
    public static BearerTokenGenerator defaults() {
        return new BearerTokenGenerator(RandomTokenGenerator.accessTokens(), null, new GrantExpiryTable());
    }

    public boolean issuesRefreshTokens() {
        return refreshTokenGenerator != null;
    }

    public BearerToken issue(Client client, String grantType) {
        return issue(client, grantType, null, null, true);
    }

    public BearerToken issue(Client client, String grantType, User user, String scope, boolean includeRefreshToken) {
        long expiresIn = expiresInResolver.expiresIn(client, grantType);
        TokenContext context = new TokenContext(client, grantType, user, scope, expiresIn);

        String accessToken = accessTokenGenerator.generate(context);
        String refreshToken = includeRefreshToken && refreshTokenGenerator != null
            ? refreshTokenGenerator.generate(context)
            : null;

        return new BearerToken(accessToken, BearerToken.TOKEN_TYPE, expiresIn, refreshToken, scope);
    }
}
