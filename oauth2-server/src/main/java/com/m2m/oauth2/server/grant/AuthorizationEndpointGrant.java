package com.m2m.oauth2.server.grant;

import com.m2m.oauth2.server.Client;
import com.m2m.oauth2.server.OAuth2Response;
import com.m2m.oauth2.server.User;

public interface AuthorizationEndpointGrant {

    /**
     * Resolves the client and redirect URI, then checks response type and scope. Failures after the
     * redirect URI is known are marked for redirect delivery.
     */
    void validateAuthorizationRequest();

    /**
     * @param grantUser {@code null} when the resource owner denied access
     */
    OAuth2Response createAuthorizationResponse(User grantUser);

    Client getClient();

    String getRedirectUri();

    String getScope();
}
