package com.m2m.oauth2.server.token;

import com.m2m.oauth2.server.Client;

@FunctionalInterface
public interface ExpiresInResolver {

    long expiresIn(Client client, String grantType);
}
