package com.m2m.oauth2.server;

/**
 * A registered OAuth2 client, as resolved by a {@link ClientStore}.
 */
public interface Client {

    String clientId();

    boolean hasClientSecret();

    /** Must compare in constant time. */
    boolean checkClientSecret(String secret);

    boolean checkTokenEndpointAuthMethod(String method);

    boolean checkRedirectUri(String redirectUri);

    /** Redirect URI to use when the request names none; {@code null} if there is no single default. */
    String defaultRedirectUri();

    boolean checkResponseType(String responseType);

    boolean checkGrantType(String grantType);

    /**
     * Narrows {@code scope} to what this client may request. A missing scope means every allowed scope.
     *
     * @return space-delimited scope, or {@code null} when nothing remains
     */
    String allowedScope(String scope);
}
