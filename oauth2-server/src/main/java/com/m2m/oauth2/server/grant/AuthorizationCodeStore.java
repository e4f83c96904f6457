package com.m2m.oauth2.server.grant;

import java.util.Optional;

public interface AuthorizationCodeStore {

    void save(AuthorizationCode code);

    Optional<AuthorizationCode> find(String code);

    /**
     * Removes the code if it is still stored.
     *
     * @return {@code true} only for the one caller that removed it
     */
    boolean delete(AuthorizationCode code);
}
