package com.m2m.oauth2.jose;

import com.m2m.oauth2.jose.key.EcCurves;
import com.m2m.oauth2.jose.key.SshPublicKeyParser;

import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.Signature;
import java.security.interfaces.ECKey;

/**
 * ES256/ES384/ES512. Signatures cross the engine boundary as raw {@code r || s}.
 */
final class EcAlgorithm extends AsymmetricAlgorithm {
    private final String signatureName;
    private final EcCurves curve;

    EcAlgorithm(String id, String signatureName, EcCurves curve) {
        super(id, "EC", SshPublicKeyParser.ECDSA_PREFIX);
        this.signatureName = signatureName;
        this.curve = curve;
    }

    @Override
    protected Signature newSignature() throws GeneralSecurityException {
        return Signature.getInstance(signatureName);
    }

    @Override
    protected void checkKey(Key key) {
        if (!(key instanceof ECKey ecKey)) {
            throw new InvalidKeyMaterialException(getId() + " requires an EC key, got " + key.getAlgorithm());
        }
        if (EcCurves.of(ecKey) != curve) {
            throw new InvalidKeyMaterialException(getId() + " requires a " + curve.jwkName() + " key");
        }
    }

    @Override
    public byte[] sign(byte[] message, Key key) {
        return EcSignatureCodec.derToRaw(signNative(message, key), curve.coordinateLength());
    }

    @Override
    public boolean verify(byte[] message, Key key, byte[] signature) {
        byte[] der;
        try {
            der = EcSignatureCodec.rawToDer(signature, curve.coordinateLength());
        } catch (InvalidSignatureFormatException e) {
            return false;
        }
        return verifyNative(message, key, der);
    }
}
