package com.m2m.oauth2.server;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * What the transport layer writes back: status, serialized body and headers.
 */
public record OAuth2Response(int status, String body, Map<String, String> headers) {

    public static final Map<String, String> JSON_HEADERS = Map.of(
        "Content-Type", "application/json;charset=UTF-8",
        "Cache-Control", "no-store",
        "Pragma", "no-cache");

    public OAuth2Response {
        body = body == null ? "" : body;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    /**
     * A 302 to {@code uri} with {@code params} appended to the query, or to the fragment when
     * {@code fragment} is set.
     */
    public static OAuth2Response redirect(String uri, Map<String, String> params, boolean fragment) {
        String encoded = params.entrySet().stream()
            .filter(e -> e.getValue() != null)
            .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
            .collect(Collectors.joining("&"));
        String location;
        if (encoded.isEmpty()) {
            location = uri;
        } else if (fragment) {
            location = uri + "#" + encoded;
        } else {
            location = uri + (uri.contains("?") ? "&" : "?") + encoded;
        }
        return new OAuth2Response(302, "", Map.of("Location", location));
    }

    public String location() {
        return headers.get("Location");
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
