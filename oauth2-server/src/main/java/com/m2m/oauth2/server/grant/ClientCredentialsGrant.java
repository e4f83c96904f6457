package com.m2m.oauth2.server.grant;

import com.m2m.oauth2.server.AuthorizationServer;
import com.m2m.oauth2.server.OAuth2Request;
import com.m2m.oauth2.server.OAuth2Response;

/**
 * RFC 6749 section 4.4. The token is issued to the client itself, without a refresh token.
 */
public class ClientCredentialsGrant extends Grant implements TokenEndpointGrant {
    public static final String GRANT_TYPE = "client_credentials";

    public static class Factory implements GrantFactory {

        @Override
        public boolean checkTokenEndpoint(OAuth2Request request) {
            return GRANT_TYPE.equals(request.grantType());
        }

        @Override
        public Grant create(OAuth2Request request, AuthorizationServer server) {
            return new ClientCredentialsGrant(request, server);
        }
    }

    ClientCredentialsGrant(OAuth2Request request, AuthorizationServer server) {
        super(request, server);
    }

    @Override
    public void validateTokenRequest() {
        authenticateTokenEndpointClient();
        checkClientGrantType(GRANT_TYPE);
        scope = validateRequestedScope(request.formParam("scope"));
    }

    @Override
    public OAuth2Response createTokenResponse() {
        return issueTokenResponse(GRANT_TYPE, null, scope, false);
    }
}
