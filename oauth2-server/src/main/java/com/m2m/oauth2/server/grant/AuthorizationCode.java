package com.m2m.oauth2.server.grant;

import java.time.Instant;

/**
 * An issued authorization code.
 *
 * @param redirectUri the URI named in the authorization request, {@code null} if the client default was used
 */
public record AuthorizationCode(
    String code,
    String clientId,
    String redirectUri,
    String scope,
    String userId,
    Instant issuedAt,
    long expiresIn
) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(issuedAt.plusSeconds(expiresIn));
    }
}
