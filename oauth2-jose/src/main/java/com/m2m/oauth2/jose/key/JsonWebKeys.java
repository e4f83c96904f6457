package com.m2m.oauth2.jose.key;

import com.m2m.oauth2.jose.InvalidKeyMaterialException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.security.Jwk;
import io.jsonwebtoken.security.Jwks;
import io.jsonwebtoken.security.PrivateJwk;
import io.jsonwebtoken.security.PublicJwk;
import io.jsonwebtoken.security.SecretJwk;

import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPublicKey;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conversion between JSON Web Keys (RFC 7517/7518) and JCA keys, on top of JJWT's {@link Jwks}.
 *
 * <p>JJWT validates the members while parsing: EC points must lie on the named curve and
 * symmetric keys carrying an {@code alg} must be long enough for it.
 */
public final class JsonWebKeys {

    private JsonWebKeys() {}

    public static Jwk<?> parse(String json) {
        try {
            return Jwks.parser().build().parse(json);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidKeyMaterialException("Key is not a valid JWK: " + e.getMessage(), e);
        }
    }

    public static boolean hasPrivateMaterial(Jwk<?> jwk) {
        return jwk instanceof PrivateJwk;
    }

    /**
     * The public half of an RSA or EC JWK. A private JWK yields its public key.
     */
    public static PublicKey toPublicKey(Jwk<?> jwk) {
        checkAsymmetric(jwk);
        if (jwk instanceof PrivateJwk<?, ?, ?> privateJwk) {
            return privateJwk.toPublicJwk().toKey();
        }
        return ((PublicJwk<?>) jwk).toKey();
    }

    public static PrivateKey toPrivateKey(Jwk<?> jwk) {
        checkAsymmetric(jwk);
        if (!(jwk instanceof PrivateJwk<?, ?, ?> privateJwk)) {
            throw new InvalidKeyMaterialException("JWK carries no private key material");
        }
        return privateJwk.toKey();
    }

    public static byte[] toSecret(Jwk<?> jwk) {
        if (!(jwk instanceof SecretJwk secretJwk)) {
            throw new InvalidKeyMaterialException("JWK is not a symmetric (oct) key");
        }
        return secretJwk.toKey().getEncoded();
    }

    /**
     * Public JWK members for an RSA or EC public key.
     */
    public static Map<String, Object> fromPublicKey(PublicKey key) {
        try {
            if (key instanceof RSAPublicKey rsa) {
                return new LinkedHashMap<>(Jwks.builder().key(rsa).build());
            }
            if (key instanceof ECPublicKey ec) {
                return new LinkedHashMap<>(Jwks.builder().key(ec).build());
            }
        } catch (JwtException e) {
            throw new InvalidKeyMaterialException("Cannot express " + key.getAlgorithm() + " key as JWK", e);
        }
        throw new InvalidKeyMaterialException("Cannot express " + key.getAlgorithm() + " key as JWK");
    }

    private static void checkAsymmetric(Jwk<?> jwk) {
        String kty = jwk.getType();
        if (!"RSA".equals(kty) && !"EC".equals(kty)) {
            throw new InvalidKeyMaterialException("No asymmetric key for JWK kty " + kty);
        }
    }
}
