package com.m2m.oauth2.jose.key;

import com.m2m.oauth2.common.Encoding;

import java.util.Objects;

/**
 * Key bytes tagged with their format, so key preparation does not have to guess.
 */
public record KeyMaterial(KeyFormat format, byte[] data) {

    public KeyMaterial {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(data, "data");
    }

    public static KeyMaterial pem(String pem) {
        return new KeyMaterial(KeyFormat.PEM, Encoding.toBytes(pem));
    }

    public static KeyMaterial ssh(String line) {
        return new KeyMaterial(KeyFormat.SSH, Encoding.toBytes(line));
    }

    public static KeyMaterial jwk(String json) {
        return new KeyMaterial(KeyFormat.JWK, Encoding.toBytes(json));
    }

    public static KeyMaterial secret(byte[] secret) {
        return new KeyMaterial(KeyFormat.SECRET, secret);
    }

    public String text() {
        return Encoding.toUnicode(data);
    }

    @Override
    public String toString() {
        return "KeyMaterial[" + format + ", " + data.length + " bytes]";
    }
}
