package com.m2m.oauth2.server.token;

import com.m2m.oauth2.jose.key.KeyFormat;
import com.m2m.oauth2.jose.key.KeyMaterial;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads signing key material from disk at server startup.
 */
public final class SigningKeyLoader {
    private SigningKeyLoader() {}

    /**
     * A {@code .json} file is a JWK, anything else PEM text, or the raw secret for HMAC algorithms.
     */
    public static KeyMaterial load(Path path, String algorithmId) throws IOException {
        byte[] content = Files.readAllBytes(path);
        if (path.getFileName().toString().endsWith(".json")) {
            return new KeyMaterial(KeyFormat.JWK, content);
        }
        if (algorithmId != null && algorithmId.startsWith("HS")) {
            return KeyMaterial.secret(content);
        }
        return KeyMaterial.pem(new String(content, StandardCharsets.UTF_8));
    }
}
