package com.m2m.oauth2.server.grant;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryAuthorizationCodeStore implements AuthorizationCodeStore {
    private final ConcurrentMap<String, AuthorizationCode> codes = new ConcurrentHashMap<>();

    @Override
    public void save(AuthorizationCode code) {
        codes.put(code.code(), code);
    }

    @Override
    public Optional<AuthorizationCode> find(String code) {
        if (code == null) return Optional.empty();
        return Optional.ofNullable(codes.get(code));
    }

    @Override
    public boolean delete(AuthorizationCode code) {
        return codes.remove(code.code(), code);
    }
}
