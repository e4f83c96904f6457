package com.m2m.oauth2.server;

/**
 * Resource owner a token is issued for.
 */
public interface User {

    String userId();
}
