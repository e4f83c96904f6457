package com.m2m.oauth2.server.grant;

import com.m2m.oauth2.server.AuthorizationServer;
import com.m2m.oauth2.server.OAuth2Request;
import com.m2m.oauth2.server.OAuth2Response;
import com.m2m.oauth2.server.User;
import com.m2m.oauth2.server.error.AccessDeniedError;
import com.m2m.oauth2.server.token.BearerToken;

import java.util.Map;

/**
 * RFC 6749 section 4.2. The access token travels in the redirect fragment; refresh tokens are
 * never issued.
 */
public class ImplicitGrant extends Grant implements AuthorizationEndpointGrant {
    public static final String RESPONSE_TYPE = "token";
    public static final String GRANT_TYPE = "implicit";

    public static class Factory implements GrantFactory {

        @Override
        public boolean checkAuthorizationEndpoint(OAuth2Request request) {
            return RESPONSE_TYPE.equals(request.responseType());
        }

        @Override
        public Grant create(OAuth2Request request, AuthorizationServer server) {
            return new ImplicitGrant(request, server);
        }
    }

    ImplicitGrant(OAuth2Request request, AuthorizationServer server) {
        super(request, server);
    }

    @Override
    public void validateAuthorizationRequest() {
        validateAuthorizationClient(RESPONSE_TYPE, true);
    }

    @Override
    public OAuth2Response createAuthorizationResponse(User grantUser) {
        String state = request.state();
        if (grantUser == null) {
            throw new AccessDeniedError().redirectTo(redirectUri, state, true);
        }

        BearerToken token = server.generateToken(client, GRANT_TYPE, grantUser, scope, false);
        server.saveToken(token, client, grantUser);

        Map<String, String> params = token.toParameters();
        if (state != null) params.put("state", state);
        return OAuth2Response.redirect(redirectUri, params, true);
    }
}
