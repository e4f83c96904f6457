package com.m2m.oauth2.server.grant;

import com.m2m.oauth2.server.AuthorizationServer;
import com.m2m.oauth2.server.OAuth2Request;

/**
 * Registered with an {@link AuthorizationServer}; decides whether it handles a request and creates
 * a fresh {@link Grant} for it. Factories are shared between threads, grants are not.
 */
public interface GrantFactory {

    default boolean checkAuthorizationEndpoint(OAuth2Request request) {
        return false;
    }

    default boolean checkTokenEndpoint(OAuth2Request request) {
        return false;
    }

    Grant create(OAuth2Request request, AuthorizationServer server);
}
