package com.m2m.oauth2.server;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Singular;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

@AllArgsConstructor
public class InMemoryClientStore implements ClientStore {

    @Builder
    public record RegisteredClient(
        String clientId,
        String clientSecret,
        String tokenEndpointAuthMethod,
        @Singular("redirectUri") List<String> redirectUris,
        @Singular Set<String> grantTypes,
        @Singular Set<String> responseTypes,
        @Singular Set<String> scopes
    ) implements Client {

        @Override
        public boolean hasClientSecret() {
            return clientSecret != null && !clientSecret.isEmpty();
        }

        @Override
        public boolean checkClientSecret(String secret) {
            if (secret == null || !hasClientSecret()) return false;
            byte[] a = clientSecret.getBytes(StandardCharsets.UTF_8);
            byte[] b = secret.getBytes(StandardCharsets.UTF_8);
            return MessageDigest.isEqual(a, b);
        }

        @Override
        public boolean checkTokenEndpointAuthMethod(String method) {
            String expected = tokenEndpointAuthMethod == null
                ? (hasClientSecret() ? "client_secret_basic" : "none")
                : tokenEndpointAuthMethod;
            // secret-bearing clients may use either secret transport
            if (method.startsWith("client_secret_") && expected.startsWith("client_secret_")) return true;
            return expected.equals(method);
        }

        @Override
        public boolean checkRedirectUri(String redirectUri) {
            return redirectUris.contains(redirectUri);
        }

        @Override
        public String defaultRedirectUri() {
            return redirectUris.size() == 1 ? redirectUris.get(0) : null;
        }

        @Override
        public boolean checkResponseType(String responseType) {
            return responseTypes.contains(responseType);
        }

        @Override
        public boolean checkGrantType(String grantType) {
            return grantTypes.contains(grantType);
        }

        @Override
        public String allowedScope(String scope) {
            Set<String> requested = scope == null || scope.isBlank()
                ? new TreeSet<>(scopes)
                : Arrays.stream(scope.split("\\s+"))
                    .filter(s -> !s.isBlank())
                    .collect(Collectors.toCollection(LinkedHashSet::new));

            requested.retainAll(scopes);

            return requested.isEmpty() ? null : String.join(" ", requested);
        }
    }

    private final Map<String, RegisteredClient> clients;

    public static InMemoryClientStore of(RegisteredClient... clients) {
        return new InMemoryClientStore(Arrays.stream(clients)
            .collect(Collectors.toUnmodifiableMap(RegisteredClient::clientId, Function.identity())));
    }

    @Override
    public Optional<Client> findClient(String clientId) {
        if (clientId == null) return Optional.empty();
        return Optional.ofNullable(clients.get(clientId.trim()));
    }
}
