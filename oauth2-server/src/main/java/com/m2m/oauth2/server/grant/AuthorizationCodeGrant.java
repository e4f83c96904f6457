package com.m2m.oauth2.server.grant;

import com.m2m.oauth2.common.SecurityTokens;
import com.m2m.oauth2.server.AuthorizationServer;
import com.m2m.oauth2.server.ClientAuthentication;
import com.m2m.oauth2.server.OAuth2Request;
import com.m2m.oauth2.server.OAuth2Response;
import com.m2m.oauth2.server.User;
import com.m2m.oauth2.server.UserStore;
import com.m2m.oauth2.server.error.AccessDeniedError;
import com.m2m.oauth2.server.error.InvalidGrantError;
import com.m2m.oauth2.server.error.InvalidRequestError;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * RFC 6749 section 4.1. The code is single use.
 */
@Slf4j
public class AuthorizationCodeGrant extends Grant implements AuthorizationEndpointGrant, TokenEndpointGrant {
    public static final String RESPONSE_TYPE = "code";
    public static final String GRANT_TYPE = "authorization_code";
    static final int CODE_LENGTH = 48;

    public static class Factory implements GrantFactory {
        public static final long DEFAULT_CODE_LIFETIME = 600;

        private final AuthorizationCodeStore codeStore;
        private final UserStore userStore;
        private final long codeLifetime;
        private final Clock clock;

        public Factory(AuthorizationCodeStore codeStore, UserStore userStore) {
            this(codeStore, userStore, DEFAULT_CODE_LIFETIME, Clock.systemUTC());
        }

        public Factory(AuthorizationCodeStore codeStore, UserStore userStore, long codeLifetime, Clock clock) {
            this.codeStore = Objects.requireNonNull(codeStore, "codeStore");
            this.userStore = Objects.requireNonNull(userStore, "userStore");
            this.codeLifetime = codeLifetime;
            this.clock = clock;
        }

        @Override
        public boolean checkAuthorizationEndpoint(OAuth2Request request) {
            return RESPONSE_TYPE.equals(request.responseType());
        }

        @Override
        public boolean checkTokenEndpoint(OAuth2Request request) {
            return GRANT_TYPE.equals(request.grantType());
        }

        @Override
        public Grant create(OAuth2Request request, AuthorizationServer server) {
            return new AuthorizationCodeGrant(request, server, this);
        }
    }

    private final Factory factory;
    private AuthorizationCode authorizationCode;
    private User user;

    AuthorizationCodeGrant(OAuth2Request request, AuthorizationServer server, Factory factory) {
        super(request, server);
        this.factory = factory;
    }

    @Override
    protected Set<String> tokenEndpointAuthMethods() {
        return Set.of(ClientAuthentication.CLIENT_SECRET_BASIC, ClientAuthentication.CLIENT_SECRET_POST,
            ClientAuthentication.NONE);
    }

    @Override
    public void validateAuthorizationRequest() {
        validateAuthorizationClient(RESPONSE_TYPE, false);
    }

    @Override
    public OAuth2Response createAuthorizationResponse(User grantUser) {
        String state = request.state();
        if (grantUser == null) {
            throw new AccessDeniedError().redirectTo(redirectUri, state, false);
        }

        AuthorizationCode code = new AuthorizationCode(
            SecurityTokens.generateToken(CODE_LENGTH),
            client.clientId(),
            request.redirectUri(),
            scope,
            grantUser.userId(),
            factory.clock.instant(),
            factory.codeLifetime);
        factory.codeStore.save(code);
        log.debug("Issued authorization code for client {}", client.clientId());

        Map<String, String> params = new LinkedHashMap<>();
        params.put("code", code.code());
        if (state != null) params.put("state", state);
        return OAuth2Response.redirect(redirectUri, params, false);
    }

    @Override
    public void validateTokenRequest() {
        authenticateTokenEndpointClient();
        checkClientGrantType(GRANT_TYPE);

        String code = request.formParam("code");
        if (code == null) {
            throw new InvalidRequestError("Missing \"code\" in request.");
        }

        AuthorizationCode stored = factory.codeStore.find(code)
            .filter(c -> c.clientId().equals(client.clientId()))
            .orElseThrow(() -> new InvalidGrantError("Invalid \"code\" in request."));

        Instant now = factory.clock.instant();
        if (stored.isExpired(now)) {
            factory.codeStore.delete(stored);
            throw new InvalidGrantError("The \"code\" has expired.");
        }

        // redirect_uri must be repeated exactly when the authorization request carried one
        if (stored.redirectUri() != null && !stored.redirectUri().equals(request.formParam("redirect_uri"))) {
            throw new InvalidGrantError("Invalid \"redirect_uri\" in request.");
        }

        user = factory.userStore.findUser(stored.userId())
            .orElseThrow(() -> new InvalidGrantError("There is no \"user\" for this code."));
        authorizationCode = stored;
    }

    @Override
    public OAuth2Response createTokenResponse() {
        if (!factory.codeStore.delete(authorizationCode)) {
            // redeemed by a concurrent request since validation
            throw new InvalidGrantError("Invalid \"code\" in request.");
        }
        boolean includeRefresh = client.checkGrantType(RefreshTokenGrant.GRANT_TYPE);
        return issueTokenResponse(GRANT_TYPE, user, authorizationCode.scope(), includeRefresh);
    }
}
