package com.m2m.oauth2.jose.key;

/**
 * Explicit encoding of caller-supplied key material.
 */
public enum KeyFormat {
    /** PEM armoured PKCS#8, PKCS#1, X.509 SubjectPublicKeyInfo or certificate. */
    PEM,
    /** OpenSSH public key line, e.g. {@code ssh-rsa AAAA... comment}. */
    SSH,
    /** JSON Web Key object. */
    JWK,
    /** Raw shared secret for MAC algorithms. */
    SECRET
}
