package com.m2m.oauth2.server.token;

import com.m2m.oauth2.server.Client;
import com.m2m.oauth2.server.User;

/**
 * What a token value generator may know about the token it is producing.
 *
 * @param user {@code null} when the token is issued to the client itself
 */
public record TokenContext(Client client, String grantType, User user, String scope, long expiresIn) {}
