package com.m2m.oauth2.jose.key;

import com.m2m.oauth2.jose.InvalidKeyMaterialException;

import java.math.BigInteger;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.ECPublicKeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.util.Base64;

/**
 * Reads OpenSSH public key lines ({@code authorized_keys} format) for RSA and NIST ECDSA keys.
 */
public final class SshPublicKeyParser {
    public static final String SSH_RSA = "ssh-rsa";
    public static final String ECDSA_PREFIX = "ecdsa-sha2-";

    private SshPublicKeyParser() {}

    public static PublicKey parse(String line) {
        if (line == null || line.isBlank()) {
            throw new InvalidKeyMaterialException("Empty SSH public key");
        }
        String[] parts = line.strip().split("\\s+");
        if (parts.length < 2) {
            throw new InvalidKeyMaterialException("SSH public key must be '<type> <base64> [comment]'");
        }
        String type = parts[0];
        ByteBuffer blob;
        try {
            blob = ByteBuffer.wrap(Base64.getDecoder().decode(parts[1]));
        } catch (IllegalArgumentException e) {
            throw new InvalidKeyMaterialException("SSH public key body is not valid base64", e);
        }

        try {
            String embedded = new String(readString(blob), StandardCharsets.US_ASCII);
            if (!embedded.equals(type)) {
                throw new InvalidKeyMaterialException("SSH key type mismatch: " + type + " vs " + embedded);
            }
            if (SSH_RSA.equals(type)) {
                BigInteger e = new BigInteger(readString(blob));
                BigInteger n = new BigInteger(readString(blob));
                return KeyFactory.getInstance("RSA").generatePublic(new RSAPublicKeySpec(n, e));
            }
            if (type.startsWith(ECDSA_PREFIX)) {
                EcCurves curve = EcCurves.fromSshName(new String(readString(blob), StandardCharsets.US_ASCII));
                if (!type.equals(ECDSA_PREFIX + curve.sshName())) {
                    throw new InvalidKeyMaterialException("SSH curve does not match key type " + type);
                }
                ECPublicKeySpec spec = new ECPublicKeySpec(curve.decodePoint(readString(blob)), curve.parameterSpec());
                return KeyFactory.getInstance("EC").generatePublic(spec);
            }
        } catch (BufferUnderflowException | IllegalArgumentException e) {
            throw new InvalidKeyMaterialException("Truncated SSH public key", e);
        } catch (GeneralSecurityException e) {
            throw new InvalidKeyMaterialException("Failed to build SSH public key", e);
        }
        throw new InvalidKeyMaterialException("Unsupported SSH key type: " + type);
    }

    private static byte[] readString(ByteBuffer buf) {
        int length = buf.getInt();
        if (length < 0 || length > buf.remaining()) {
            throw new IllegalArgumentException("Bad SSH string length " + length);
        }
        byte[] out = new byte[length];
        buf.get(out);
        return out;
    }
}
