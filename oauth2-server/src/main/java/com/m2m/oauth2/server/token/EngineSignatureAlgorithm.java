package com.m2m.oauth2.server.token;

import com.m2m.oauth2.jose.JwsAlgorithm;
import io.jsonwebtoken.security.SecureDigestAlgorithm;
import io.jsonwebtoken.security.SecureRequest;
import io.jsonwebtoken.security.SignatureException;
import io.jsonwebtoken.security.VerifySecureDigestRequest;

import java.io.IOException;
import java.io.InputStream;
import java.security.Key;

/**
 * Lets JJWT's builder and parser delegate signature computation to a {@link JwsAlgorithm}.
 */
public final class EngineSignatureAlgorithm implements SecureDigestAlgorithm<Key, Key> {
    private final JwsAlgorithm algorithm;

    public EngineSignatureAlgorithm(JwsAlgorithm algorithm) {
        this.algorithm = algorithm;
    }

    @Override
    public String getId() {
        return algorithm.getId();
    }

    @Override
    public byte[] digest(SecureRequest<InputStream, Key> request) {
        return algorithm.sign(payload(request.getPayload()), request.getKey());
    }

    @Override
    public boolean verify(VerifySecureDigestRequest<Key> request) {
        return algorithm.verify(payload(request.getPayload()), request.getKey(), request.getDigest());
    }

    private byte[] payload(InputStream in) {
        try {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new SignatureException("Unable to read " + algorithm.getId() + " signing input", e);
        }
    }
}
