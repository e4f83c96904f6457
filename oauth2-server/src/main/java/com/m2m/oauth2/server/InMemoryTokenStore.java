package com.m2m.oauth2.server;

import com.m2m.oauth2.server.token.BearerToken;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keeps tokens in memory, indexed by access and refresh token value.
 *
 * <p>Entries are never evicted, expired or revoked ones included. Meant for tests and embedding,
 * not for long-running servers.
 */
public class InMemoryTokenStore implements TokenStore {

    public record StoredToken(
        String accessToken,
        String refreshToken,
        String clientId,
        String userId,
        String scope,
        Instant issuedAt,
        long expiresIn,
        boolean revoked
    ) implements OAuth2Token {

        StoredToken asRevoked() {
            return new StoredToken(accessToken, refreshToken, clientId, userId, scope, issuedAt, expiresIn, true);
        }
    }

    private final ConcurrentMap<String, StoredToken> byAccessToken = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> accessByRefreshToken = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTokenStore() {
        this(Clock.systemUTC());
    }

    public InMemoryTokenStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void save(BearerToken token, Client client, User user) {
        StoredToken stored = new StoredToken(
            token.accessToken(),
            token.refreshToken(),
            client.clientId(),
            user == null ? null : user.userId(),
            token.scope(),
            clock.instant(),
            token.expiresIn(),
            false);
        byAccessToken.put(stored.accessToken(), stored);
        if (stored.refreshToken() != null) {
            accessByRefreshToken.put(stored.refreshToken(), stored.accessToken());
        }
    }

    @Override
    public Optional<OAuth2Token> find(String token, String tokenTypeHint) {
        if (token == null) return Optional.empty();
        if ("access_token".equals(tokenTypeHint)) return byAccess(token);
        if ("refresh_token".equals(tokenTypeHint)) return byRefresh(token);
        return byAccess(token).or(() -> byRefresh(token));
    }

    @Override
    public boolean revoke(OAuth2Token token) {
        StoredToken current = byAccessToken.get(token.accessToken());
        return current != null
            && !current.revoked()
            && byAccessToken.replace(current.accessToken(), current, current.asRevoked());
    }

    private Optional<OAuth2Token> byAccess(String token) {
        return Optional.ofNullable(byAccessToken.get(token));
    }

    private Optional<OAuth2Token> byRefresh(String token) {
        String access = accessByRefreshToken.get(token);
        return access == null ? Optional.empty() : byAccess(access);
    }
}
