package com.m2m.oauth2.server.grant;

import com.m2m.oauth2.server.OAuth2Response;

public interface TokenEndpointGrant {

    void validateTokenRequest();

    OAuth2Response createTokenResponse();
}
