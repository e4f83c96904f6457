package com.m2m.oauth2.server;

import java.util.Optional;

public interface UserStore {

    /** Resource owner password check for the {@code password} grant. */
    Optional<User> authenticate(String username, String password);

    Optional<User> findUser(String userId);
}
