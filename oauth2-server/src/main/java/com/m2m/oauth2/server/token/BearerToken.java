package com.m2m.oauth2.server.token;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RFC 6750 token response body.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BearerToken(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("expires_in") long expiresIn,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("scope") String scope
) {
    public static final String TOKEN_TYPE = "Bearer";
    public static final long DEFAULT_EXPIRES_IN = 3600;

    /** Parameters for an implicit grant redirect fragment. */
    public Map<String, String> toParameters() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("access_token", accessToken);
        params.put("token_type", tokenType);
        params.put("expires_in", Long.toString(expiresIn));
        if (refreshToken != null) params.put("refresh_token", refreshToken);
        if (scope != null) params.put("scope", scope);
        return params;
    }
}
