package com.m2m.oauth2.jose;

import com.m2m.oauth2.common.Encoding;
import com.m2m.oauth2.jose.key.Der;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Converts ECDSA signatures between the DER {@code SEQUENCE { r, s }} produced by JCA and the
 * fixed-width {@code r || s} form JWS uses.
 */
public final class EcSignatureCodec {
    private EcSignatureCodec() {}

    public static byte[] derToRaw(byte[] der, int coordinateLength) {
        BigInteger r;
        BigInteger s;
        try {
            Der.Reader outer = new Der.Reader(der);
            Der.Reader seq = outer.readSequence();
            r = seq.readInteger();
            s = seq.readInteger();
            if (seq.hasRemaining() || outer.hasRemaining()) {
                throw new InvalidSignatureFormatException("Trailing bytes in DER signature");
            }
        } catch (IllegalArgumentException e) {
            throw new InvalidSignatureFormatException("Malformed DER signature: " + e.getMessage());
        }
        byte[] raw = new byte[2 * coordinateLength];
        writePadded(r, raw, 0, coordinateLength);
        writePadded(s, raw, coordinateLength, coordinateLength);
        return raw;
    }

    /**
     * @throws InvalidSignatureFormatException if {@code raw} is not exactly {@code 2 * coordinateLength} bytes
     */
    public static byte[] rawToDer(byte[] raw, int coordinateLength) {
        if (raw == null || raw.length != 2 * coordinateLength) {
            throw new InvalidSignatureFormatException("Invalid signature");
        }
        BigInteger r = new BigInteger(1, Arrays.copyOfRange(raw, 0, coordinateLength));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(raw, coordinateLength, raw.length));
        return Der.sequence(Der.integer(r), Der.integer(s));
    }

    private static void writePadded(BigInteger value, byte[] out, int offset, int length) {
        if (value.signum() < 0) {
            throw new InvalidSignatureFormatException("Negative signature component");
        }
        byte[] bytes = Encoding.unsignedBytes(value);
        if (bytes.length > length) {
            throw new InvalidSignatureFormatException("Signature component exceeds curve size");
        }
        System.arraycopy(bytes, 0, out, offset + length - bytes.length, bytes.length);
    }
}
