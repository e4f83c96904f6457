package com.m2m.oauth2.jose;

import com.m2m.oauth2.common.Encoding;
import com.m2m.oauth2.jose.key.JsonWebKeys;
import com.m2m.oauth2.jose.key.KeyMaterial;

import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.security.InvalidKeyException;
import java.security.Key;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * HS256/HS384/HS512.
 */
final class HmacAlgorithm implements JwsAlgorithm {
    private final String id;
    private final String macName;

    HmacAlgorithm(String id, String macName) {
        this.id = id;
        this.macName = macName;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public Key prepareSignKey(Object rawKey) {
        return toSecretKey(rawKey);
    }

    @Override
    public Key prepareVerifyKey(Object rawKey) {
        return toSecretKey(rawKey);
    }

    @Override
    public byte[] sign(byte[] message, Key key) {
        if (!(key instanceof SecretKey)) {
            throw new InvalidKeyMaterialException(id + " requires a secret key");
        }
        try {
            Mac mac = Mac.getInstance(macName);
            mac.init(key);
            return mac.doFinal(message);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(macName + " not available", e);
        } catch (InvalidKeyException e) {
            throw new InvalidKeyMaterialException("Secret rejected by " + macName, e);
        }
    }

    @Override
    public boolean verify(byte[] message, Key key, byte[] signature) {
        if (signature == null) return false;
        return MessageDigest.isEqual(signature, sign(message, key));
    }

    private SecretKey toSecretKey(Object rawKey) {
        if (rawKey instanceof SecretKey secret) return secret;
        if (rawKey instanceof PublicKey || rawKey instanceof PrivateKey) {
            throw new InvalidKeyMaterialException(id + " cannot use an asymmetric key");
        }
        byte[] secret;
        if (rawKey instanceof KeyMaterial material) {
            secret = switch (material.format()) {
                case SECRET -> material.data();
                case JWK -> JsonWebKeys.toSecret(JsonWebKeys.parse(material.text()));
                default -> throw new InvalidKeyMaterialException(id + " cannot use " + material.format() + " material");
            };
        } else {
            secret = asBytes(rawKey);
        }
        if (secret == null || secret.length == 0) {
            throw new InvalidKeyMaterialException(id + " requires a non-empty secret");
        }
        return new SecretKeySpec(secret, macName);
    }

    private byte[] asBytes(Object rawKey) {
        try {
            return Encoding.toBytes(rawKey);
        } catch (IllegalArgumentException e) {
            throw new InvalidKeyMaterialException(e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return id;
    }
}
