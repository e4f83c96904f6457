package com.m2m.oauth2.server.grant;

import com.m2m.oauth2.server.AuthorizationServer;
import com.m2m.oauth2.server.ClientAuthentication;
import com.m2m.oauth2.server.OAuth2Request;
import com.m2m.oauth2.server.OAuth2Response;
import com.m2m.oauth2.server.OAuth2Token;
import com.m2m.oauth2.server.Scopes;
import com.m2m.oauth2.server.User;
import com.m2m.oauth2.server.UserStore;
import com.m2m.oauth2.server.error.InvalidGrantError;
import com.m2m.oauth2.server.error.InvalidRequestError;
import com.m2m.oauth2.server.error.InvalidScopeError;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;

/**
 * RFC 6749 section 6. Issues a new token pair and revokes the one that was refreshed.
 */
@Slf4j
public class RefreshTokenGrant extends Grant implements TokenEndpointGrant {
    public static final String GRANT_TYPE = "refresh_token";

    @AllArgsConstructor
    public static class Factory implements GrantFactory {
        private final UserStore userStore;

        @Override
        public boolean checkTokenEndpoint(OAuth2Request request) {
            return GRANT_TYPE.equals(request.grantType());
        }

        @Override
        public Grant create(OAuth2Request request, AuthorizationServer server) {
            return new RefreshTokenGrant(request, server, userStore);
        }
    }

    private final UserStore userStore;
    private OAuth2Token credential;
    private User user;

    RefreshTokenGrant(OAuth2Request request, AuthorizationServer server, UserStore userStore) {
        super(request, server);
        this.userStore = userStore;
    }

    @Override
    protected Set<String> tokenEndpointAuthMethods() {
        return Set.of(ClientAuthentication.CLIENT_SECRET_BASIC, ClientAuthentication.CLIENT_SECRET_POST,
            ClientAuthentication.NONE);
    }

    @Override
    public void validateTokenRequest() {
        authenticateTokenEndpointClient();
        checkClientGrantType(GRANT_TYPE);

        String refreshToken = request.formParam("refresh_token");
        if (refreshToken == null) {
            throw new InvalidRequestError("Missing \"refresh_token\" in request.");
        }

        credential = server.getTokenStore().find(refreshToken, "refresh_token")
            .filter(t -> t.checkClient(client))
            .filter(t -> !t.revoked())
            .orElseThrow(() -> new InvalidGrantError("Invalid \"refresh_token\" in request."));

        String requested = request.formParam("scope");
        if (requested == null) {
            scope = credential.scope();
        } else {
            if (!Scopes.isWellFormed(requested)) {
                throw new InvalidScopeError("Malformed \"scope\" in request.");
            }
            if (!Scopes.split(credential.scope()).containsAll(Scopes.split(requested))) {
                throw new InvalidScopeError("The requested scope exceeds the original grant.");
            }
            scope = requested;
        }

        if (credential.userId() != null) {
            user = userStore.findUser(credential.userId())
                .orElseThrow(() -> new InvalidGrantError("There is no \"user\" for this token."));
        }
    }

    @Override
    public OAuth2Response createTokenResponse() {
        if (!server.getTokenStore().revoke(credential)) {
            // refreshed or revoked by a concurrent request since validation
            throw new InvalidGrantError("Invalid \"refresh_token\" in request.");
        }
        log.debug("Revoked refreshed token of client {}", client.clientId());
        return issueTokenResponse(GRANT_TYPE, user, scope, true);
    }
}
