package com.m2m.oauth2.jose.key;

import com.m2m.oauth2.jose.InvalidKeyMaterialException;

import java.io.ByteArrayInputStream;
import java.math.BigInteger;
import java.security.*;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses PEM armoured keys. Encrypted private keys are not supported.
 */
public final class PemKeyLoader {
    private static final Pattern PEM_BLOCK =
        Pattern.compile("-----BEGIN ([A-Z0-9 ]+)-----(.*?)-----END \\1-----", Pattern.DOTALL);

    private PemKeyLoader() {}

    /**
     * @param keyAlgorithm JCA key algorithm, {@code RSA} or {@code EC}
     */
    public static PrivateKey loadPrivateKey(String pem, String keyAlgorithm) {
        Block block = parse(pem);
        byte[] pkcs8 = switch (block.type()) {
            case "PRIVATE KEY" -> block.der();
            case "RSA PRIVATE KEY" -> wrapRsaPrivateKey(block.der());
            case "ENCRYPTED PRIVATE KEY" -> throw new InvalidKeyMaterialException("Encrypted private keys are not supported");
            default -> throw new InvalidKeyMaterialException("Not a private key PEM block: " + block.type());
        };
        try {
            return KeyFactory.getInstance(keyAlgorithm).generatePrivate(new PKCS8EncodedKeySpec(pkcs8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(keyAlgorithm + " not available", e);
        } catch (InvalidKeySpecException e) {
            throw new InvalidKeyMaterialException("Failed to parse private key from PEM", e);
        }
    }

    public static PublicKey loadPublicKey(String pem, String keyAlgorithm) {
        Block block = parse(pem);
        if ("CERTIFICATE".equals(block.type())) {
            return loadCertificateKey(block.der());
        }
        byte[] spki = switch (block.type()) {
            case "PUBLIC KEY" -> block.der();
            case "RSA PUBLIC KEY" -> Der.sequence(Der.rsaAlgorithmIdentifier(), Der.bitString(block.der()));
            default -> throw new InvalidKeyMaterialException("Not a public key PEM block: " + block.type());
        };
        try {
            return KeyFactory.getInstance(keyAlgorithm).generatePublic(new X509EncodedKeySpec(spki));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(keyAlgorithm + " not available", e);
        } catch (InvalidKeySpecException e) {
            throw new InvalidKeyMaterialException("Failed to parse public key from PEM", e);
        }
    }

    private static PublicKey loadCertificateKey(byte[] der) {
        try {
            return CertificateFactory.getInstance("X.509")
                .generateCertificate(new ByteArrayInputStream(der))
                .getPublicKey();
        } catch (CertificateException e) {
            throw new InvalidKeyMaterialException("Failed to parse certificate from PEM", e);
        }
    }

    // PrivateKeyInfo ::= SEQUENCE { version INTEGER, algorithm AlgorithmIdentifier, privateKey OCTET STRING }
    private static byte[] wrapRsaPrivateKey(byte[] pkcs1) {
        return Der.sequence(
            Der.integer(BigInteger.ZERO),
            Der.rsaAlgorithmIdentifier(),
            Der.tlv(Der.OCTET_STRING, pkcs1));
    }

    private static Block parse(String pem) {
        if (pem == null) {
            throw new InvalidKeyMaterialException("PEM input is null");
        }
        Matcher m = PEM_BLOCK.matcher(pem);
        if (!m.find()) {
            throw new InvalidKeyMaterialException("No PEM block found");
        }
        try {
            byte[] der = Base64.getMimeDecoder().decode(m.group(2).replaceAll("\\s+", ""));
            return new Block(m.group(1), der);
        } catch (IllegalArgumentException e) {
            throw new InvalidKeyMaterialException("PEM body is not valid base64", e);
        }
    }

    private record Block(String type, byte[] der) {}
}
