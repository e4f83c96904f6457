package com.m2m.oauth2.server.endpoint;

import com.m2m.oauth2.server.AuthorizationServer;
import com.m2m.oauth2.server.OAuth2Request;
import com.m2m.oauth2.server.OAuth2Response;

/**
 * A named endpoint beyond authorize and token, dispatched by
 * {@link AuthorizationServer#createEndpointResponse}.
 */
public interface Endpoint {

    String name();

    /**
     * @throws com.m2m.oauth2.server.error.OAuth2Error rendered by the server
     */
    OAuth2Response createEndpointResponse(OAuth2Request request, AuthorizationServer server);
}
