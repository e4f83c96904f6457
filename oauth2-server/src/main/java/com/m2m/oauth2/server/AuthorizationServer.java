package com.m2m.oauth2.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.m2m.oauth2.jose.JoseException;
import com.m2m.oauth2.jose.JwsAlgorithm;
import com.m2m.oauth2.jose.JwsAlgorithms;
import com.m2m.oauth2.jose.key.KeyMaterial;
import com.m2m.oauth2.server.endpoint.Endpoint;
import com.m2m.oauth2.server.error.InvalidRequestError;
import com.m2m.oauth2.server.error.OAuth2Error;
import com.m2m.oauth2.server.error.ServerError;
import com.m2m.oauth2.server.error.ServerMisconfigurationException;
import com.m2m.oauth2.server.error.UnsupportedGrantTypeError;
import com.m2m.oauth2.server.error.UnsupportedResponseTypeError;
import com.m2m.oauth2.server.grant.AuthorizationEndpointGrant;
import com.m2m.oauth2.server.grant.Grant;
import com.m2m.oauth2.server.grant.GrantFactory;
import com.m2m.oauth2.server.grant.TokenEndpointGrant;
import com.m2m.oauth2.server.token.BearerToken;
import com.m2m.oauth2.server.token.BearerTokenGenerator;
import com.m2m.oauth2.server.token.GrantExpiryTable;
import com.m2m.oauth2.server.token.JwtAccessTokenGenerator;
import com.m2m.oauth2.server.token.RandomTokenGenerator;
import com.m2m.oauth2.server.token.SigningKeyLoader;
import com.m2m.oauth2.server.token.TokenValueGenerator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.security.Key;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs the authorization and token endpoint lifecycle over registered grants.
 *
 * <p>Each call handles one request start to finish: resolve the grant, authenticate the client,
 * validate, issue, and render an {@link OAuth2Response}. {@link OAuth2Error}s raised on the way are
 * turned into error responses here and never propagate to the caller, except from
 * {@link #validateConsentRequest} where the caller renders the consent page.
 */
@Slf4j
public class AuthorizationServer {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Getter
    private final ClientStore clientStore;
    @Getter
    private final TokenStore tokenStore;
    private final BearerTokenGenerator tokenGenerator;
    private final Map<String, String> errorUris;

    private final List<GrantFactory> grants = new CopyOnWriteArrayList<>();
    private final Map<String, Endpoint> endpoints = new ConcurrentHashMap<>();
    private final List<AuthorizationServerListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * @throws ServerMisconfigurationException if the configuration cannot produce a working server
     */
    public AuthorizationServer(ClientStore clientStore, TokenStore tokenStore, AuthorizationServerConfig config) {
        this(clientStore, tokenStore, createBearerTokenGenerator(config), config.getErrorUris());
    }

    public AuthorizationServer(ClientStore clientStore,
                               TokenStore tokenStore,
                               BearerTokenGenerator tokenGenerator,
                               Map<String, String> errorUris) {
        this.clientStore = clientStore;
        this.tokenStore = tokenStore;
        this.tokenGenerator = tokenGenerator;
        this.errorUris = errorUris == null ? Map.of() : Map.copyOf(errorUris);
    }

    public void registerGrant(GrantFactory factory) {
        grants.add(factory);
    }

    public void registerEndpoint(Endpoint endpoint) {
        endpoints.put(endpoint.name(), endpoint);
    }

    public void addListener(AuthorizationServerListener listener) {
        listeners.add(listener);
    }

    /**
     * Validates an authorization request before showing the consent page.
     *
     * @throws OAuth2Error when the request is invalid
     */
    public AuthorizationEndpointGrant validateConsentRequest(OAuth2Request request, User endUser) {
        AuthorizationEndpointGrant grant = getAuthorizationGrant(request);
        grant.validateAuthorizationRequest();
        return grant;
    }

    /**
     * @param grantUser the resource owner who approved, or {@code null} if access was denied
     */
    public OAuth2Response createAuthorizationResponse(OAuth2Request request, User grantUser) {
        try {
            AuthorizationEndpointGrant grant = getAuthorizationGrant(request);
            grant.validateAuthorizationRequest();
            return grant.createAuthorizationResponse(grantUser);
        } catch (OAuth2Error e) {
            return handleError(e);
        } catch (JoseException e) {
            log.error("Token signing failed at authorization endpoint", e);
            return handleError(new ServerError());
        }
    }

    public OAuth2Response createTokenResponse(OAuth2Request request) {
        try {
            if (!request.isPost()) {
                throw new InvalidRequestError("Token requests must use POST.");
            }
            TokenEndpointGrant grant = getTokenGrant(request);
            grant.validateTokenRequest();
            return grant.createTokenResponse();
        } catch (OAuth2Error e) {
            return handleError(e);
        } catch (JoseException e) {
            log.error("Token signing failed at token endpoint", e);
            return handleError(new ServerError());
        }
    }

    /**
     * Dispatches to a registered endpoint such as {@code revocation}.
     *
     * @throws IllegalArgumentException if no endpoint is registered under {@code name}
     */
    public OAuth2Response createEndpointResponse(String name, OAuth2Request request) {
        Endpoint endpoint = endpoints.get(name);
        if (endpoint == null) {
            throw new IllegalArgumentException("No endpoint registered as '" + name + "'");
        }
        try {
            return endpoint.createEndpointResponse(request, this);
        } catch (OAuth2Error e) {
            return handleError(e);
        }
    }

    public Client authenticateClient(OAuth2Request request, Set<String> methods) {
        return ClientAuthentication.authenticate(clientStore, request, methods);
    }

    public BearerToken generateToken(Client client, String grantType, User user, String scope,
                                     boolean includeRefreshToken) {
        BearerToken token = tokenGenerator.issue(client, grantType, user, scope, includeRefreshToken);
        log.debug("Issued {} token for client {}", grantType, client.clientId());
        return token;
    }

    public void saveToken(BearerToken token, Client client, User user) {
        tokenStore.save(token, client, user);
    }

    public void notifyClientAuthenticated(Client client, Grant grant) {
        for (AuthorizationServerListener listener : listeners) {
            listener.onClientAuthenticated(client, grant);
        }
    }

    public void notifyTokenRevoked(OAuth2Token token, Client client) {
        log.debug("Revoked token of client {}", client.clientId());
        for (AuthorizationServerListener listener : listeners) {
            listener.onTokenRevoked(token, client);
        }
    }

    public OAuth2Response jsonResponse(int status, Object body, Map<String, String> extraHeaders) {
        Map<String, String> headers = new LinkedHashMap<>(OAuth2Response.JSON_HEADERS);
        headers.putAll(extraHeaders);
        try {
            return new OAuth2Response(status, MAPPER.writeValueAsString(body), headers);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize response body", e);
        }
    }

    public OAuth2Response jsonResponse(int status, Object body) {
        return jsonResponse(status, body, Map.of());
    }

    public OAuth2Response handleError(OAuth2Error error) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error.getError());
        if (error.getDescription() != null) body.put("error_description", error.getDescription());
        String uri = errorUris.get(error.getError());
        if (uri != null) body.put("error_uri", uri);

        if (error.isRedirect()) {
            if (error.getState() != null) body.put("state", error.getState());
            return OAuth2Response.redirect(error.getRedirectUri(), body, error.isFragment());
        }
        return jsonResponse(error.getStatus(), body, error.headers());
    }

    private AuthorizationEndpointGrant getAuthorizationGrant(OAuth2Request request) {
        for (GrantFactory factory : grants) {
            if (factory.checkAuthorizationEndpoint(request)) {
                Grant grant = factory.create(request, this);
                log.debug("Resolved {} for response_type={}", grant.getClass().getSimpleName(), request.responseType());
                return (AuthorizationEndpointGrant) grant;
            }
        }
        throw new UnsupportedResponseTypeError("response_type=" + request.responseType() + " is not supported");
    }

    private TokenEndpointGrant getTokenGrant(OAuth2Request request) {
        for (GrantFactory factory : grants) {
            if (factory.checkTokenEndpoint(request)) {
                Grant grant = factory.create(request, this);
                log.debug("Resolved {} for grant_type={}", grant.getClass().getSimpleName(), request.grantType());
                return (TokenEndpointGrant) grant;
            }
        }
        throw new UnsupportedGrantTypeError("grant_type=" + request.grantType() + " is not supported");
    }

    static BearerTokenGenerator createBearerTokenGenerator(AuthorizationServerConfig config) {
        GrantExpiryTable expires;
        try {
            expires = new GrantExpiryTable(config.getExpiresIn());
        } catch (IllegalArgumentException e) {
            throw misconfigured(e.getMessage(), e);
        }

        TokenValueGenerator access = config.getAccessTokenGenerator();
        if (access == null) {
            access = config.isJwtEnabled() ? createJwtGenerator(config) : RandomTokenGenerator.accessTokens();
        }

        TokenValueGenerator refresh = config.getRefreshTokenGenerator();
        if (refresh == null && config.isRefreshTokenEnabled()) {
            refresh = RandomTokenGenerator.refreshTokens();
        }
        return new BearerTokenGenerator(access, refresh, expires);
    }

    private static JwtAccessTokenGenerator createJwtGenerator(AuthorizationServerConfig config) {
        String issuer = config.getJwtIssuer();
        if (issuer == null || issuer.isBlank()) {
            throw misconfigured("Missing \"OAUTH2_JWT_ISS\" configuration.", null);
        }

        JwsAlgorithm algorithm;
        try {
            algorithm = JwsAlgorithms.get(config.getJwtAlgorithm());
        } catch (JoseException e) {
            throw misconfigured("Unsupported \"OAUTH2_JWT_ALG\": " + config.getJwtAlgorithm(), e);
        }
        if ("none".equals(algorithm.getId())) {
            throw misconfigured("\"OAUTH2_JWT_ALG\" must not be 'none'.", null);
        }

        Object rawKey = config.getJwtKey();
        if (config.getJwtKeyPath() != null) {
            try {
                KeyMaterial material = SigningKeyLoader.load(config.getJwtKeyPath(), algorithm.getId());
                rawKey = material;
            } catch (IOException e) {
                throw misconfigured("Cannot read \"OAUTH2_JWT_KEY_PATH\": " + config.getJwtKeyPath(), e);
            }
        }
        if (rawKey == null) {
            throw misconfigured("Missing \"OAUTH2_JWT_KEY\" configuration.", null);
        }

        Key signingKey;
        try {
            signingKey = algorithm.prepareSignKey(rawKey);
        } catch (JoseException e) {
            throw misconfigured("Invalid \"OAUTH2_JWT_KEY\" for " + algorithm.getId(), e);
        }
        return new JwtAccessTokenGenerator(algorithm, signingKey, issuer, config.getJwtKeyId());
    }

    private static ServerMisconfigurationException misconfigured(String message, Throwable cause) {
        log.error(message);
        return new ServerMisconfigurationException(message, cause);
    }
}
