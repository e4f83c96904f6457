package com.m2m.oauth2.jose;

import java.security.Key;

/**
 * A JWS "alg" value: key preparation plus sign/verify over raw message bytes.
 *
 * <p>Prepared keys are plain JCA keys and are never cached. Implementations are stateless and
 * safe to share between threads.
 */
public interface JwsAlgorithm {

    /** Registered identifier, e.g. {@code HS256}. */
    String getId();

    /**
     * Normalizes caller material into a key usable by {@link #sign}.
     *
     * @param rawKey a {@link Key} of the right family, a {@link com.m2m.oauth2.jose.key.KeyMaterial},
     *               or PEM/SSH/JWK/secret text or bytes
     * @throws InvalidKeyMaterialException if the input cannot be turned into a signing key
     */
    Key prepareSignKey(Object rawKey);

    /**
     * Normalizes caller material into a key usable by {@link #verify}.
     *
     * @throws InvalidKeyMaterialException if the input cannot be turned into a verification key
     */
    Key prepareVerifyKey(Object rawKey);

    byte[] sign(byte[] message, Key key);

    /**
     * Checks {@code signature} over {@code message}. Malformed signature bytes yield {@code false},
     * never an exception.
     */
    boolean verify(byte[] message, Key key, byte[] signature);
}
