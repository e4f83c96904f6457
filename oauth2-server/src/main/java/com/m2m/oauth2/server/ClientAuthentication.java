package com.m2m.oauth2.server;

import com.m2m.oauth2.server.error.InvalidClientError;
import lombok.extern.slf4j.Slf4j;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;
import java.util.Set;

/**
 * Token endpoint client authentication (RFC 6749 section 2.3).
 */
@Slf4j
public final class ClientAuthentication {
    public static final String CLIENT_SECRET_BASIC = "client_secret_basic";
    public static final String CLIENT_SECRET_POST = "client_secret_post";
    public static final String NONE = "none";

    private ClientAuthentication() {}

    static Client authenticate(ClientStore clientStore, OAuth2Request request, Set<String> methods) {
        String authHeader = request.header("Authorization");
        boolean triedBasic = authHeader != null && authHeader.startsWith("Basic ");

        if (methods.contains(CLIENT_SECRET_BASIC) && triedBasic) {
            String[] creds = parseBasic(authHeader);
            if (creds != null) {
                Optional<Client> client = verified(clientStore, creds[0], creds[1], CLIENT_SECRET_BASIC);
                if (client.isPresent()) return client.get();
            }
        }

        String clientId = request.formParam("client_id");
        String clientSecret = request.formParam("client_secret");
        if (methods.contains(CLIENT_SECRET_POST) && clientId != null && clientSecret != null) {
            Optional<Client> client = verified(clientStore, clientId, clientSecret, CLIENT_SECRET_POST);
            if (client.isPresent()) return client.get();
        }

        if (methods.contains(NONE) && clientId != null && clientSecret == null && !triedBasic) {
            Optional<Client> client = clientStore.findClient(clientId)
                .filter(c -> !c.hasClientSecret() && c.checkTokenEndpointAuthMethod(NONE));
            if (client.isPresent()) return client.get();
        }

        log.debug("Client authentication failed for client_id={}", clientId != null ? clientId : "<basic>");
        throw new InvalidClientError("Client authentication failed.", triedBasic);
    }

    private static Optional<Client> verified(ClientStore clientStore, String clientId, String secret, String method) {
        return clientStore.findClient(clientId)
            .filter(c -> c.checkClientSecret(secret))
            .filter(c -> c.checkTokenEndpointAuthMethod(method));
    }

    private static String[] parseBasic(String auth) {
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(auth.substring(6).trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
        String s = new String(raw, StandardCharsets.UTF_8);
        int idx = s.indexOf(":");
        if (idx <= 0) return null;
        try {
            return new String[]{
                URLDecoder.decode(s.substring(0, idx), StandardCharsets.UTF_8),
                URLDecoder.decode(s.substring(idx + 1), StandardCharsets.UTF_8)
            };
        } catch (IllegalArgumentException e) {
            // malformed %-escape
            return null;
        }
    }
}
