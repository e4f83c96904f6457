package com.m2m.oauth2.jose;

import com.m2m.oauth2.jose.key.SshPublicKeyParser;

import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.Signature;
import java.security.interfaces.RSAKey;

/**
 * RS256/RS384/RS512, RSASSA-PKCS1-v1_5.
 */
class RsaAlgorithm extends AsymmetricAlgorithm {
    private final String signatureName;

    RsaAlgorithm(String id, String signatureName) {
        super(id, "RSA", SshPublicKeyParser.SSH_RSA);
        this.signatureName = signatureName;
    }

    @Override
    protected Signature newSignature() throws GeneralSecurityException {
        return Signature.getInstance(signatureName);
    }

    @Override
    protected void checkKey(Key key) {
        if (!(key instanceof RSAKey)) {
            throw new InvalidKeyMaterialException(getId() + " requires an RSA key, got " + key.getAlgorithm());
        }
    }

    @Override
    public byte[] sign(byte[] message, Key key) {
        return signNative(message, key);
    }

    @Override
    public boolean verify(byte[] message, Key key, byte[] signature) {
        return verifyNative(message, key, signature);
    }
}
