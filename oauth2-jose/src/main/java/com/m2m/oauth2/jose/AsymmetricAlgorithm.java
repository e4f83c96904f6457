package com.m2m.oauth2.jose;

import com.m2m.oauth2.common.Encoding;
import com.m2m.oauth2.jose.key.JsonWebKeys;
import com.m2m.oauth2.jose.key.KeyMaterial;
import com.m2m.oauth2.jose.key.PemKeyLoader;
import com.m2m.oauth2.jose.key.SshPublicKeyParser;
import lombok.extern.slf4j.Slf4j;

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.Key;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;

/**
 * Key preparation and JCA plumbing shared by the RSA and EC families.
 */
@Slf4j
abstract class AsymmetricAlgorithm implements JwsAlgorithm {
    private final String id;
    private final String keyAlgorithm;
    private final String sshPrefix;

    AsymmetricAlgorithm(String id, String keyAlgorithm, String sshPrefix) {
        this.id = id;
        this.keyAlgorithm = keyAlgorithm;
        this.sshPrefix = sshPrefix;
    }

    @Override
    public String getId() {
        return id;
    }

    /** A configured, not yet initialised JCA signature engine. */
    protected abstract Signature newSignature() throws GeneralSecurityException;

    /** Throws {@link InvalidKeyMaterialException} when {@code key} is not of this algorithm's family. */
    protected abstract void checkKey(Key key);

    @Override
    public Key prepareSignKey(Object rawKey) {
        PrivateKey key;
        if (rawKey instanceof PrivateKey privateKey) {
            key = privateKey;
        } else if (rawKey instanceof Key) {
            throw new InvalidKeyMaterialException(id + " signs with a private key");
        } else if (rawKey instanceof KeyMaterial material) {
            key = switch (material.format()) {
                case PEM -> PemKeyLoader.loadPrivateKey(material.text(), keyAlgorithm);
                case JWK -> JsonWebKeys.toPrivateKey(JsonWebKeys.parse(material.text()));
                default -> throw new InvalidKeyMaterialException(id + " cannot sign with " + material.format() + " material");
            };
        } else {
            String text = asText(rawKey);
            key = text.startsWith("{")
                ? JsonWebKeys.toPrivateKey(JsonWebKeys.parse(text))
                : PemKeyLoader.loadPrivateKey(text, keyAlgorithm);
        }
        checkKey(key);
        return key;
    }

    @Override
    public Key prepareVerifyKey(Object rawKey) {
        PublicKey key;
        if (rawKey instanceof PublicKey publicKey) {
            key = publicKey;
        } else if (rawKey instanceof Key) {
            throw new InvalidKeyMaterialException(id + " verifies with a public key");
        } else if (rawKey instanceof KeyMaterial material) {
            key = switch (material.format()) {
                case PEM -> PemKeyLoader.loadPublicKey(material.text(), keyAlgorithm);
                case SSH -> SshPublicKeyParser.parse(material.text());
                case JWK -> JsonWebKeys.toPublicKey(JsonWebKeys.parse(material.text()));
                default -> throw new InvalidKeyMaterialException(id + " cannot verify with " + material.format() + " material");
            };
        } else {
            String text = asText(rawKey);
            if (text.startsWith(sshPrefix)) {
                key = SshPublicKeyParser.parse(text);
            } else if (text.startsWith("{")) {
                key = JsonWebKeys.toPublicKey(JsonWebKeys.parse(text));
            } else {
                key = PemKeyLoader.loadPublicKey(text, keyAlgorithm);
            }
        }
        checkKey(key);
        return key;
    }

    /**
     * JCA signature in the primitive's native encoding.
     */
    protected byte[] signNative(byte[] message, Key key) {
        if (!(key instanceof PrivateKey privateKey)) {
            throw new InvalidKeyMaterialException(id + " signs with a private key");
        }
        checkKey(key);
        try {
            Signature signature = newSignature();
            signature.initSign(privateKey);
            signature.update(message);
            return signature.sign();
        } catch (InvalidKeyException e) {
            throw new InvalidKeyMaterialException("Key rejected by " + id, e);
        } catch (SignatureException e) {
            throw new JoseException(id + " signing failed", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(id + " not available", e);
        }
    }

    protected boolean verifyNative(byte[] message, Key key, byte[] signatureBytes) {
        if (!(key instanceof PublicKey publicKey)) {
            throw new InvalidKeyMaterialException(id + " verifies with a public key");
        }
        checkKey(key);
        if (signatureBytes == null) return false;
        try {
            Signature signature = newSignature();
            signature.initVerify(publicKey);
            signature.update(message);
            return signature.verify(signatureBytes);
        } catch (SignatureException e) {
            log.debug("{} signature rejected: {}", id, e.getMessage());
            return false;
        } catch (InvalidKeyException e) {
            throw new InvalidKeyMaterialException("Key rejected by " + id, e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(id + " not available", e);
        }
    }

    private String asText(Object rawKey) {
        if (rawKey == null) {
            throw new InvalidKeyMaterialException(id + " requires key material");
        }
        try {
            return Encoding.toUnicode(Encoding.toBytes(rawKey)).strip();
        } catch (IllegalArgumentException e) {
            throw new InvalidKeyMaterialException(e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return id;
    }
}
