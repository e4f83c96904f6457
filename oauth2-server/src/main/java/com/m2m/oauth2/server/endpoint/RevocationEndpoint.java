package com.m2m.oauth2.server.endpoint;

import com.m2m.oauth2.server.AuthorizationServer;
import com.m2m.oauth2.server.Client;
import com.m2m.oauth2.server.ClientAuthentication;
import com.m2m.oauth2.server.OAuth2Request;
import com.m2m.oauth2.server.OAuth2Response;
import com.m2m.oauth2.server.OAuth2Token;
import com.m2m.oauth2.server.error.InvalidRequestError;
import com.m2m.oauth2.server.error.UnsupportedTokenTypeError;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * RFC 7009 token revocation. Answers 200 whether or not the token was known, so clients cannot
 * probe for valid tokens.
 */
public class RevocationEndpoint implements Endpoint {
    public static final String ENDPOINT_NAME = "revocation";
    static final Set<String> TOKEN_TYPE_HINTS = Set.of("access_token", "refresh_token");

    @Override
    public String name() {
        return ENDPOINT_NAME;
    }

    @Override
    public OAuth2Response createEndpointResponse(OAuth2Request request, AuthorizationServer server) {
        if (!request.isPost()) {
            throw new InvalidRequestError("Revocation requests must use POST.");
        }
        Client client = server.authenticateClient(request,
            Set.of(ClientAuthentication.CLIENT_SECRET_BASIC, ClientAuthentication.CLIENT_SECRET_POST));

        String token = request.formParam("token");
        if (token == null) {
            throw new InvalidRequestError("Missing \"token\" in request.");
        }
        String hint = request.formParam("token_type_hint");
        if (hint != null && !TOKEN_TYPE_HINTS.contains(hint)) {
            throw new UnsupportedTokenTypeError();
        }

        Optional<OAuth2Token> found = server.getTokenStore().find(token, hint)
            .filter(t -> t.checkClient(client));
        found.ifPresent(t -> {
            server.getTokenStore().revoke(t);
            server.notifyTokenRevoked(t, client);
        });
        return server.jsonResponse(200, Map.of());
    }
}
