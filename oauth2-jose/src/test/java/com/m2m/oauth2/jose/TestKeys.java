package com.m2m.oauth2.jose;

import com.m2m.oauth2.common.Encoding;
import com.m2m.oauth2.jose.key.EcCurves;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.ECGenParameterSpec;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * Key pairs shared across tests; generating RSA keys per test is slow.
 */
public final class TestKeys {
    private static final Map<String, KeyPair> CACHE = new HashMap<>();

    private TestKeys() {}

    public static synchronized KeyPair rsa() {
        return CACHE.computeIfAbsent("rsa", k -> generate("RSA", 2048, null));
    }

    public static synchronized KeyPair otherRsa() {
        return CACHE.computeIfAbsent("rsa2", k -> generate("RSA", 2048, null));
    }

    public static synchronized KeyPair ec(EcCurves curve) {
        String name = switch (curve) {
            case P_256 -> "secp256r1";
            case P_384 -> "secp384r1";
            case P_521 -> "secp521r1";
        };
        return CACHE.computeIfAbsent(name, k -> generate("EC", 0, name));
    }

    /** Key pair suitable for the given asymmetric algorithm id. */
    public static KeyPair forAlgorithm(String id) {
        return switch (id) {
            case "ES256" -> ec(EcCurves.P_256);
            case "ES384" -> ec(EcCurves.P_384);
            case "ES512" -> ec(EcCurves.P_521);
            default -> rsa();
        };
    }

    public static String pem(String type, byte[] der) {
        String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII)).encodeToString(der);
        return "-----BEGIN " + type + "-----\n" + body + "\n-----END " + type + "-----\n";
    }

    public static String privatePem(Key key) {
        return pem("PRIVATE KEY", key.getEncoded());
    }

    public static String publicPem(Key key) {
        return pem("PUBLIC KEY", key.getEncoded());
    }

    public static String sshRsa(RSAPublicKey key) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        sshString(out, "ssh-rsa".getBytes(StandardCharsets.US_ASCII));
        sshString(out, key.getPublicExponent().toByteArray());
        sshString(out, key.getModulus().toByteArray());
        return "ssh-rsa " + Base64.getEncoder().encodeToString(out.toByteArray()) + " test@example";
    }

    public static String sshEc(ECPublicKey key) {
        EcCurves curve = EcCurves.of(key);
        String type = "ecdsa-sha2-" + curve.sshName();
        int len = curve.coordinateLength();
        byte[] point = new byte[1 + 2 * len];
        point[0] = 0x04;
        copyPadded(key.getW().getAffineX(), point, 1, len);
        copyPadded(key.getW().getAffineY(), point, 1 + len, len);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        sshString(out, type.getBytes(StandardCharsets.US_ASCII));
        sshString(out, curve.sshName().getBytes(StandardCharsets.US_ASCII));
        sshString(out, point);
        return type + " " + Base64.getEncoder().encodeToString(out.toByteArray());
    }

    private static void copyPadded(BigInteger value, byte[] out, int offset, int len) {
        byte[] raw = Encoding.unsignedBytes(value);
        System.arraycopy(raw, 0, out, offset + len - raw.length, raw.length);
    }

    private static void sshString(ByteArrayOutputStream out, byte[] value) {
        out.writeBytes(ByteBuffer.allocate(4).putInt(value.length).array());
        out.writeBytes(value);
    }

    private static KeyPair generate(String algorithm, int bits, String curve) {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance(algorithm);
            if (curve != null) {
                generator.initialize(new ECGenParameterSpec(curve));
            } else {
                generator.initialize(bits);
            }
            return generator.generateKeyPair();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
