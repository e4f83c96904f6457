package com.m2m.oauth2.server;

import com.m2m.oauth2.server.error.ServerMisconfigurationException;
import com.m2m.oauth2.server.token.TokenValueGenerator;
import lombok.Getter;
import lombok.Setter;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

@Getter
@Setter
public class AuthorizationServerConfig {
    static final String PREFIX = "OAUTH2_";
    static final String EXPIRES_PREFIX = PREFIX + "EXPIRES_";

    /** Lifetime overrides in seconds, keyed by grant type. */
    private Map<String, Long> expiresIn = new HashMap<>();
    private TokenValueGenerator accessTokenGenerator;
    private TokenValueGenerator refreshTokenGenerator;
    private boolean refreshTokenEnabled;

    private boolean jwtEnabled;
    private String jwtIssuer;
    /** Key material in any form the configured algorithm accepts. */
    private Object jwtKey;
    private Path jwtKeyPath;
    private String jwtAlgorithm = "RS256";
    private String jwtKeyId;

    /** {@code error_uri} values, keyed by error code. */
    private Map<String, String> errorUris = new HashMap<>();

    /**
     * Reads the {@code OAUTH2_*} keys. Unknown keys are ignored.
     *
     * @throws ServerMisconfigurationException on malformed values
     */
    public static AuthorizationServerConfig fromProperties(Properties props) {
        AuthorizationServerConfig config = new AuthorizationServerConfig();
        for (String name : props.stringPropertyNames()) {
            String value = props.getProperty(name).trim();
            if (name.startsWith(EXPIRES_PREFIX)) {
                String grantType = name.substring(EXPIRES_PREFIX.length()).toLowerCase(Locale.ROOT);
                config.expiresIn.put(grantType, parseSeconds(name, value));
                continue;
            }
            switch (name) {
                case "OAUTH2_ACCESS_TOKEN_GENERATOR" -> config.accessTokenGenerator = instantiate(name, value);
                case "OAUTH2_REFRESH_TOKEN_GENERATOR" -> {
                    if (Boolean.parseBoolean(value)) {
                        config.refreshTokenEnabled = true;
                    } else if (!"false".equalsIgnoreCase(value) && !value.isEmpty()) {
                        config.refreshTokenGenerator = instantiate(name, value);
                        config.refreshTokenEnabled = true;
                    }
                }
                case "OAUTH2_JWT_ENABLED" -> config.jwtEnabled = Boolean.parseBoolean(value);
                case "OAUTH2_JWT_ISS" -> config.jwtIssuer = value;
                case "OAUTH2_JWT_KEY" -> config.jwtKey = value;
                case "OAUTH2_JWT_KEY_PATH" -> config.jwtKeyPath = Path.of(value);
                case "OAUTH2_JWT_ALG" -> config.jwtAlgorithm = value;
                case "OAUTH2_JWT_KID" -> config.jwtKeyId = value;
                case "OAUTH2_ERROR_URIS" -> config.errorUris.putAll(parsePairs(name, value));
                default -> {
                }
            }
        }
        return config;
    }

    private static long parseSeconds(String name, String value) {
        try {
            long seconds = Long.parseLong(value);
            if (seconds <= 0) {
                throw new ServerMisconfigurationException(name + " must be positive, got " + value);
            }
            return seconds;
        } catch (NumberFormatException e) {
            throw new ServerMisconfigurationException(name + " is not a number: " + value, e);
        }
    }

    private static Map<String, String> parsePairs(String name, String value) {
        Map<String, String> pairs = new HashMap<>();
        for (String pair : value.split(",")) {
            if (pair.isBlank()) continue;
            int idx = pair.indexOf('=');
            if (idx <= 0) {
                throw new ServerMisconfigurationException(name + " entries must be error=uri, got " + pair);
            }
            pairs.put(pair.substring(0, idx).trim(), pair.substring(idx + 1).trim());
        }
        return pairs;
    }

    private static TokenValueGenerator instantiate(String name, String className) {
        try {
            return Class.forName(className)
                .asSubclass(TokenValueGenerator.class)
                .getDeclaredConstructor()
                .newInstance();
        } catch (ReflectiveOperationException | ClassCastException e) {
            throw new ServerMisconfigurationException(name + " cannot load " + className, e);
        }
    }
}
