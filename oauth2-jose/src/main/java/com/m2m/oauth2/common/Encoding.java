package com.m2m.oauth2.common;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

/**
 * Byte/text normalization and base64url helpers shared by keys and tokens.
 */
public final class Encoding {
    private Encoding() {}

    public static byte[] toBytes(Object value) {
        if (value == null) return null;
        if (value instanceof byte[] bytes) return bytes;
        if (value instanceof CharSequence text) return text.toString().getBytes(StandardCharsets.UTF_8);
        if (value instanceof Number number) return number.toString().getBytes(StandardCharsets.UTF_8);
        throw new IllegalArgumentException("Cannot convert " + value.getClass().getName() + " to bytes");
    }

    public static String toUnicode(byte[] value) {
        return value == null ? null : new String(value, StandardCharsets.UTF_8);
    }

    public static String urlsafeB64Encode(byte[] data) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(data);
    }

    /**
     * Decodes base64url text, with or without trailing {@code =} padding.
     */
    public static byte[] urlsafeB64Decode(String text) {
        String s = text.strip();
        int rem = s.length() % 4;
        if (rem != 0) {
            s = s + "=".repeat(4 - rem);
        }
        return Base64.getUrlDecoder().decode(s.getBytes(StandardCharsets.US_ASCII));
    }

    /**
     * Encodes a non-negative integer as unpadded base64url over its minimal big-endian bytes,
     * the form JWK uses for {@code n}, {@code e}, {@code x}, {@code y} and friends.
     */
    public static String intToBase64(BigInteger num) {
        if (num.signum() < 0) {
            throw new IllegalArgumentException("Must be a positive integer");
        }
        return urlsafeB64Encode(unsignedBytes(num));
    }

    public static BigInteger base64ToInt(String text) {
        return new BigInteger(1, urlsafeB64Decode(text));
    }

    /**
     * Big-endian magnitude of {@code num} without the sign byte {@link BigInteger#toByteArray()} adds.
     */
    public static byte[] unsignedBytes(BigInteger num) {
        byte[] raw = num.toByteArray();
        int length = (num.bitLength() + 7) / 8;
        if (raw.length == length) return raw;
        return Arrays.copyOfRange(raw, raw.length - length, raw.length);
    }
}
