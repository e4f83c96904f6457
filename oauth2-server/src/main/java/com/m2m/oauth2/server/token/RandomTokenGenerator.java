package com.m2m.oauth2.server.token;

import com.m2m.oauth2.common.SecurityTokens;

/**
 * Opaque random tokens.
 */
public final class RandomTokenGenerator implements TokenValueGenerator {
    public static final int ACCESS_TOKEN_LENGTH = 42;
    public static final int REFRESH_TOKEN_LENGTH = 48;

    private final int length;

    public RandomTokenGenerator(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Token length must be positive");
        }
        this.length = length;
    }

    public static RandomTokenGenerator accessTokens() {
        return new RandomTokenGenerator(ACCESS_TOKEN_LENGTH);
    }

    public static RandomTokenGenerator refreshTokens() {
        return new RandomTokenGenerator(REFRESH_TOKEN_LENGTH);
    }

    @Override
    public String generate(TokenContext context) {
        return SecurityTokens.generateToken(length);
    }
}
