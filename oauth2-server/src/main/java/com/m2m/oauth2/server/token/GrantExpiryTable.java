package com.m2m.oauth2.server.token;

import com.m2m.oauth2.server.Client;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Token lifetime in seconds per grant type. Immutable once built.
 */
public final class GrantExpiryTable implements ExpiresInResolver {
    public static final Map<String, Long> DEFAULTS = Map.of(
        "authorization_code", 864000L,
        "implicit", 3600L,
        "password", 864000L,
        "client_credentials", 864000L);

    private final Map<String, Long> table;

    public GrantExpiryTable() {
        this(Map.of());
    }

    /**
     * @param overrides lifetimes that replace the defaults, keyed by grant type
     */
    public GrantExpiryTable(Map<String, Long> overrides) {
        Map<String, Long> m = new HashMap<>(DEFAULTS);
        overrides.forEach((grantType, seconds) -> {
            if (seconds == null || seconds <= 0) {
                throw new IllegalArgumentException("Expiry for " + grantType + " must be positive");
            }
            m.put(normalize(grantType), seconds);
        });
        this.table = Map.copyOf(m);
    }

    @Override
    public long expiresIn(Client client, String grantType) {
        Long seconds = grantType == null ? null : table.get(normalize(grantType));
        return seconds == null ? BearerToken.DEFAULT_EXPIRES_IN : seconds;
    }

    // "client_credential" is accepted as an alias of the registered grant type name
    static String normalize(String grantType) {
        String key = grantType.toLowerCase(Locale.ROOT);
        return "client_credential".equals(key) ? "client_credentials" : key;
    }
}
