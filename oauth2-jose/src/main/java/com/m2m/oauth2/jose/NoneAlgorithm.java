package com.m2m.oauth2.jose;

import java.security.Key;

/**
 * The unsecured {@code none} algorithm. Produces an empty signature and never verifies.
 */
final class NoneAlgorithm implements JwsAlgorithm {

    @Override
    public String getId() {
        return "none";
    }

    @Override
    public Key prepareSignKey(Object rawKey) {
        return null;
    }

    @Override
    public Key prepareVerifyKey(Object rawKey) {
        return null;
    }

    @Override
    public byte[] sign(byte[] message, Key key) {
        return new byte[0];
    }

    @Override
    public boolean verify(byte[] message, Key key, byte[] signature) {
        return false;
    }
}
