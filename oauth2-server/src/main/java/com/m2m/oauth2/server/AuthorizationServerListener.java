package com.m2m.oauth2.server;

import com.m2m.oauth2.server.grant.Grant;

/**
 * Observer of lifecycle events, for audit and telemetry. Invoked synchronously on the request thread.
 */
public interface AuthorizationServerListener {

    default void onClientAuthenticated(Client client, Grant grant) {
    }

    default void onTokenRevoked(OAuth2Token token, Client client) {
    }
}
