package com.m2m.oauth2.server.error;

public class ServerError extends OAuth2Error {

    public ServerError() {
        super("server_error", null, 500);
    }
}
