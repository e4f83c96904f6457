package com.m2m.oauth2.server.token;

/**
 * Produces the string value of an access or refresh token.
 */
@FunctionalInterface
public interface TokenValueGenerator {

    String generate(TokenContext context);
}
