package com.m2m.oauth2.server.grant;

import com.m2m.oauth2.server.AuthorizationServer;
import com.m2m.oauth2.server.Client;
import com.m2m.oauth2.server.ClientAuthentication;
import com.m2m.oauth2.server.OAuth2Request;
import com.m2m.oauth2.server.OAuth2Response;
import com.m2m.oauth2.server.Scopes;
import com.m2m.oauth2.server.User;
import com.m2m.oauth2.server.error.InvalidClientError;
import com.m2m.oauth2.server.error.InvalidRequestError;
import com.m2m.oauth2.server.error.InvalidScopeError;
import com.m2m.oauth2.server.error.OAuth2Error;
import com.m2m.oauth2.server.error.UnauthorizedClientError;
import com.m2m.oauth2.server.token.BearerToken;
import lombok.Getter;

import java.util.Set;

/**
 * State of one grant flow for one request.
 */
@Getter
public abstract class Grant {
    protected final OAuth2Request request;
    protected final AuthorizationServer server;
    protected Client client;
    protected String redirectUri;
    protected String scope;

    protected Grant(OAuth2Request request, AuthorizationServer server) {
        this.request = request;
        this.server = server;
    }

    /** Client authentication methods accepted at the token endpoint. */
    protected Set<String> tokenEndpointAuthMethods() {
        return Set.of(ClientAuthentication.CLIENT_SECRET_BASIC);
    }

    protected Client authenticateTokenEndpointClient() {
        client = server.authenticateClient(request, tokenEndpointAuthMethods());
        server.notifyClientAuthenticated(client, this);
        return client;
    }

    protected void checkClientGrantType(String grantType) {
        if (!client.checkGrantType(grantType)) {
            throw new UnauthorizedClientError("The client is not authorized to use \"grant_type=" + grantType + "\"");
        }
    }

    /**
     * Checks the requested scope is well-formed and narrows it to what the client may request.
     *
     * @return the granted scope, {@code null} if none was requested and none is allowed
     */
    protected String validateRequestedScope(String requested) {
        if (requested != null && !Scopes.isWellFormed(requested)) {
            throw new InvalidScopeError("Malformed \"scope\" in request.");
        }
        String allowed = client.allowedScope(requested);
        if (requested != null && allowed == null) {
            throw new InvalidScopeError("The requested scope is not allowed for this client.");
        }
        return allowed;
    }

    /**
     * Authorization endpoint preamble: finds the client, then the redirect URI. Errors before the
     * redirect URI is trusted are never redirected.
     */
    protected void validateAuthorizationClient(String responseType, boolean fragment) {
        String clientId = request.clientId();
        if (clientId == null) {
            throw new InvalidClientError("Missing \"client_id\" in request.");
        }
        client = server.getClientStore().findClient(clientId)
            .orElseThrow(() -> new InvalidClientError("The client does not exist on this server."));

        String requestedUri = request.redirectUri();
        if (requestedUri == null) {
            redirectUri = client.defaultRedirectUri();
            if (redirectUri == null) {
                throw new InvalidRequestError("Missing \"redirect_uri\" in request.");
            }
        } else if (client.checkRedirectUri(requestedUri)) {
            redirectUri = requestedUri;
        } else {
            throw new InvalidRequestError("Redirect URI " + requestedUri + " is not supported by client.");
        }

        try {
            if (!client.checkResponseType(responseType)) {
                throw new UnauthorizedClientError("The client is not authorized to use \"response_type=" + responseType + "\"");
            }
            scope = validateRequestedScope(request.scope());
        } catch (OAuth2Error e) {
            throw e.redirectTo(redirectUri, request.state(), fragment);
        }
    }

    protected OAuth2Response issueTokenResponse(String grantType, User user, String tokenScope, boolean includeRefreshToken) {
        BearerToken token = server.generateToken(client, grantType, user, tokenScope, includeRefreshToken);
        server.saveToken(token, client, user);
        return server.jsonResponse(200, token);
    }
}
