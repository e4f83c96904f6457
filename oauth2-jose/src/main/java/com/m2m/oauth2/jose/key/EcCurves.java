package com.m2m.oauth2.jose.key;

import com.m2m.oauth2.jose.InvalidKeyMaterialException;

import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.interfaces.ECKey;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.ECPoint;
import java.math.BigInteger;
import java.util.Arrays;

/**
 * The three NIST curves JOSE names, under their JWK, SSH and JCA aliases.
 */
public enum EcCurves {
    P_256("P-256", "nistp256", "secp256r1", 256),
    P_384("P-384", "nistp384", "secp384r1", 384),
    P_521("P-521", "nistp521", "secp521r1", 521);

    private final String jwkName;
    private final String sshName;
    private final String jcaName;
    private final int fieldBits;

    EcCurves(String jwkName, String sshName, String jcaName, int fieldBits) {
        this.jwkName = jwkName;
        this.sshName = sshName;
        this.jcaName = jcaName;
        this.fieldBits = fieldBits;
    }

    public String jwkName() {
        return jwkName;
    }

    public String sshName() {
        return sshName;
    }

    public int fieldBits() {
        return fieldBits;
    }

    /** Byte length of one coordinate, {@code ceil(fieldBits / 8)}. */
    public int coordinateLength() {
        return (fieldBits + 7) / 8;
    }

    public ECParameterSpec parameterSpec() {
        try {
            AlgorithmParameters params = AlgorithmParameters.getInstance("EC");
            params.init(new ECGenParameterSpec(jcaName));
            return params.getParameterSpec(ECParameterSpec.class);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Curve " + jcaName + " not available", e);
        }
    }

    public static EcCurves fromSshName(String name) {
        return Arrays.stream(values())
            .filter(c -> c.sshName.equals(name))
            .findFirst()
            .orElseThrow(() -> new InvalidKeyMaterialException("Unsupported SSH curve: " + name));
    }

    public static EcCurves of(ECKey key) {
        int bits = key.getParams().getCurve().getField().getFieldSize();
        return Arrays.stream(values())
            .filter(c -> c.fieldBits == bits)
            .findFirst()
            .orElseThrow(() -> new InvalidKeyMaterialException("Unsupported curve size: " + bits));
    }

    /**
     * Decodes an uncompressed SEC1 point ({@code 0x04 || X || Y}).
     */
    public ECPoint decodePoint(byte[] encoded) {
        int len = coordinateLength();
        if (encoded.length != 1 + 2 * len || encoded[0] != 0x04) {
            throw new InvalidKeyMaterialException("Only uncompressed EC points are supported");
        }
        BigInteger x = new BigInteger(1, Arrays.copyOfRange(encoded, 1, 1 + len));
        BigInteger y = new BigInteger(1, Arrays.copyOfRange(encoded, 1 + len, encoded.length));
        return new ECPoint(x, y);
    }
}
