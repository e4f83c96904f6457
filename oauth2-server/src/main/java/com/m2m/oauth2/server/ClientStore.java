package com.m2m.oauth2.server;

import java.util.Optional;

/**
 * Source of OAuth2 clients.
 * Implement this from env, DB, config, etc.
 */
public interface ClientStore {

    Optional<Client> findClient(String clientId);
}
