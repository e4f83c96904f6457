package com.m2m.oauth2.jose.key;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;

/**
 * Just enough DER to build and split the structures this library deals with:
 * ECDSA {@code SEQUENCE { r, s }} signatures and PKCS#1 to PKCS#8/X.509 key wrapping.
 */
public final class Der {
    public static final int INTEGER = 0x02;
    public static final int BIT_STRING = 0x03;
    public static final int OCTET_STRING = 0x04;
    public static final int NULL = 0x05;
    public static final int OBJECT_IDENTIFIER = 0x06;
    public static final int SEQUENCE = 0x30;

    /** rsaEncryption, 1.2.840.113549.1.1.1 */
    static final byte[] RSA_ENCRYPTION_OID = {
        0x2a, (byte) 0x86, 0x48, (byte) 0x86, (byte) 0xf7, 0x0d, 0x01, 0x01, 0x01
    };

    private Der() {}

    public static byte[] tlv(int tag, byte[] content) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(content.length + 6);
        out.write(tag);
        writeLength(out, content.length);
        out.writeBytes(content);
        return out.toByteArray();
    }

    public static byte[] sequence(byte[]... elements) {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        for (byte[] e : elements) {
            body.writeBytes(e);
        }
        return tlv(SEQUENCE, body.toByteArray());
    }

    public static byte[] integer(BigInteger value) {
        return tlv(INTEGER, value.toByteArray());
    }

    public static byte[] nullValue() {
        return new byte[]{NULL, 0x00};
    }

    public static byte[] bitString(byte[] data) {
        byte[] content = new byte[data.length + 1];
        System.arraycopy(data, 0, content, 1, data.length);
        return tlv(BIT_STRING, content);
    }

    public static byte[] rsaAlgorithmIdentifier() {
        return sequence(tlv(OBJECT_IDENTIFIER, RSA_ENCRYPTION_OID), nullValue());
    }

    private static void writeLength(ByteArrayOutputStream out, int length) {
        if (length < 0x80) {
            out.write(length);
            return;
        }
        int bytes = length > 0xffffff ? 4 : length > 0xffff ? 3 : length > 0xff ? 2 : 1;
        out.write(0x80 | bytes);
        for (int i = bytes - 1; i >= 0; i--) {
            out.write((length >>> (8 * i)) & 0xff);
        }
    }

    /**
     * Sequential reader over DER bytes. Every malformation surfaces as {@link IllegalArgumentException}.
     */
    public static final class Reader {
        private final byte[] data;
        private int pos;
        private final int end;

        public Reader(byte[] data) {
            this(data, 0, data.length);
        }

        private Reader(byte[] data, int offset, int end) {
            this.data = data;
            this.pos = offset;
            this.end = end;
        }

        public boolean hasRemaining() {
            return pos < end;
        }

        public Reader readSequence() {
            int length = expect(SEQUENCE);
            Reader inner = new Reader(data, pos, pos + length);
            pos += length;
            return inner;
        }

        public BigInteger readInteger() {
            int length = expect(INTEGER);
            if (length == 0) {
                throw new IllegalArgumentException("Empty INTEGER");
            }
            BigInteger value = new BigInteger(slice(length));
            pos += length;
            return value;
        }

        private byte[] slice(int length) {
            byte[] out = new byte[length];
            System.arraycopy(data, pos, out, 0, length);
            return out;
        }

        private int expect(int tag) {
            if (pos >= end) {
                throw new IllegalArgumentException("Unexpected end of DER input");
            }
            int actual = data[pos++] & 0xff;
            if (actual != tag) {
                throw new IllegalArgumentException(String.format("Expected tag 0x%02x but found 0x%02x", tag, actual));
            }
            int length = readLength();
            if (length > end - pos) {
                throw new IllegalArgumentException("DER length exceeds input");
            }
            return length;
        }

        private int readLength() {
            if (pos >= end) {
                throw new IllegalArgumentException("Unexpected end of DER input");
            }
            int first = data[pos++] & 0xff;
            if (first < 0x80) {
                return first;
            }
            int count = first & 0x7f;
            if (count == 0 || count > 4 || count > end - pos) {
                throw new IllegalArgumentException("Unsupported DER length encoding");
            }
            int length = 0;
            for (int i = 0; i < count; i++) {
                length = (length << 8) | (data[pos++] & 0xff);
            }
            if (length < 0) {
                throw new IllegalArgumentException("Negative DER length");
            }
            return length;
        }
    }
}
