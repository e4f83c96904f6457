package com.m2m.oauth2.server.token;

import com.m2m.oauth2.jose.JwsAlgorithm;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;

import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Signed JWT access tokens. JJWT builds the token; the signature comes from the algorithm engine.
 */
public final class JwtAccessTokenGenerator implements TokenValueGenerator {
    private final JwsAlgorithm algorithm;
    private final Key signingKey;
    private final String issuer;
    private final String keyId;
    private final Clock clock;

    /**
     * @param signingKey key already prepared by {@code algorithm.prepareSignKey}
     * @param keyId      optional {@code kid} header
     */
    public JwtAccessTokenGenerator(JwsAlgorithm algorithm, Key signingKey, String issuer, String keyId) {
        this(algorithm, signingKey, issuer, keyId, Clock.systemUTC());
    }

    JwtAccessTokenGenerator(JwsAlgorithm algorithm, Key signingKey, String issuer, String keyId, Clock clock) {
        if ("none".equals(algorithm.getId())) {
            throw new IllegalArgumentException("The 'none' algorithm cannot sign access tokens");
        }
        this.algorithm = algorithm;
        this.signingKey = signingKey;
        this.issuer = issuer;
        this.keyId = keyId;
        this.clock = clock;
    }

    @Override
    public String generate(TokenContext context) {
        Instant now = clock.instant();
        Instant exp = now.plusSeconds(context.expiresIn());
        String clientId = context.client().clientId();

        JwtBuilder builder = Jwts.builder()
            .issuer(issuer)
            .subject(context.user() != null ? context.user().userId() : clientId)
            .audience().add(clientId).and()
            .id(UUID.randomUUID().toString())
            .issuedAt(Date.from(now))
            .expiration(Date.from(exp))
            .claim("client_id", clientId)
            .claim("grant_type", context.grantType());
        if (context.scope() != null) {
            builder.claim("scope", context.scope());
        }
        if (keyId != null) {
            builder.header().keyId(keyId).and();
        }

        return builder
            .signWith(signingKey, new EngineSignatureAlgorithm(algorithm))
            .compact();
    }
}
