package com.m2m.oauth2.server.grant;

import com.m2m.oauth2.server.AuthorizationServer;
import com.m2m.oauth2.server.OAuth2Request;
import com.m2m.oauth2.server.OAuth2Response;
import com.m2m.oauth2.server.User;
import com.m2m.oauth2.server.UserStore;
import com.m2m.oauth2.server.error.InvalidRequestError;
import lombok.AllArgsConstructor;

/**
 * RFC 6749 section 4.3.
 */
public class ResourceOwnerPasswordGrant extends Grant implements TokenEndpointGrant {
    public static final String GRANT_TYPE = "password";

    @AllArgsConstructor
    public static class Factory implements GrantFactory {
        private final UserStore userStore;

        @Override
        public boolean checkTokenEndpoint(OAuth2Request request) {
            return GRANT_TYPE.equals(request.grantType());
        }

        @Override
        public Grant create(OAuth2Request request, AuthorizationServer server) {
            return new ResourceOwnerPasswordGrant(request, server, userStore);
        }
    }

    private final UserStore userStore;
    private User user;

    ResourceOwnerPasswordGrant(OAuth2Request request, AuthorizationServer server, UserStore userStore) {
        super(request, server);
        this.userStore = userStore;
    }

    @Override
    public void validateTokenRequest() {
        authenticateTokenEndpointClient();
        checkClientGrantType(GRANT_TYPE);

        String username = request.formParam("username");
        if (username == null) {
            throw new InvalidRequestError("Missing \"username\" in request.");
        }
        String password = request.formParam("password");
        if (password == null) {
            throw new InvalidRequestError("Missing \"password\" in request.");
        }

        user = userStore.authenticate(username, password)
            .orElseThrow(() -> new InvalidRequestError("Invalid \"username\" or \"password\" in request."));
        scope = validateRequestedScope(request.formParam("scope"));
    }

    @Override
    public OAuth2Response createTokenResponse() {
        boolean includeRefresh = client.checkGrantType(RefreshTokenGrant.GRANT_TYPE);
        return issueTokenResponse(GRANT_TYPE, user, scope, includeRefresh);
    }
}
