package com.m2m.oauth2.jose;

import com.m2m.oauth2.jose.key.EcCurves;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Process-wide registry of the JWS algorithms from RFC 7518 section 3, keyed by "alg" value.
 * Built once at class initialisation and read-only afterwards.
 */
public final class JwsAlgorithms {
    private static final Map<String, JwsAlgorithm> ALGORITHMS;

    static {
        Map<String, JwsAlgorithm> m = new LinkedHashMap<>();
        register(m, new NoneAlgorithm());
        register(m, new HmacAlgorithm("HS256", "HmacSHA256"));
        register(m, new HmacAlgorithm("HS384", "HmacSHA384"));
        register(m, new HmacAlgorithm("HS512", "HmacSHA512"));
        register(m, new RsaAlgorithm("RS256", "SHA256withRSA"));
        register(m, new RsaAlgorithm("RS384", "SHA384withRSA"));
        register(m, new RsaAlgorithm("RS512", "SHA512withRSA"));
        register(m, new EcAlgorithm("ES256", "SHA256withECDSA", EcCurves.P_256));
        register(m, new EcAlgorithm("ES384", "SHA384withECDSA", EcCurves.P_384));
        register(m, new EcAlgorithm("ES512", "SHA512withECDSA", EcCurves.P_521));
        register(m, new RsaPssAlgorithm("PS256", "SHA-256", 32));
        register(m, new RsaPssAlgorithm("PS384", "SHA-384", 48));
        register(m, new RsaPssAlgorithm("PS512", "SHA-512", 64));
        ALGORITHMS = Collections.unmodifiableMap(m);
    }

    private JwsAlgorithms() {}

    private static void register(Map<String, JwsAlgorithm> m, JwsAlgorithm algorithm) {
        m.put(algorithm.getId(), algorithm);
    }

    /**
     * @throws UnsupportedAlgorithmException if {@code id} is not registered
     */
    public static JwsAlgorithm get(String id) {
        JwsAlgorithm algorithm = id == null ? null : ALGORITHMS.get(id);
        if (algorithm == null) {
            throw new UnsupportedAlgorithmException(id);
        }
        return algorithm;
    }

    public static boolean contains(String id) {
        return id != null && ALGORITHMS.containsKey(id);
    }

    public static Set<String> names() {
        return ALGORITHMS.keySet();
    }
}
