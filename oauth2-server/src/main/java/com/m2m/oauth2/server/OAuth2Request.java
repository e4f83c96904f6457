package com.m2m.oauth2.server;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Transport-neutral view of an inbound OAuth2 HTTP request.
 *
 * @param form form-decoded body; only populated for POST requests
 */
public record OAuth2Request(String method, URI uri, Map<String, String> form, Map<String, String> headers) {

    public OAuth2Request {
        method = method == null ? "GET" : method.toUpperCase(java.util.Locale.ROOT);
        form = "POST".equals(method) && form != null ? Map.copyOf(form) : Map.of();
        Map<String, String> h = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) h.putAll(headers);
        headers = Collections.unmodifiableMap(h);
    }

    public static OAuth2Request get(String url) {
        return new OAuth2Request("GET", URI.create(url), null, null);
    }

    public static OAuth2Request post(String url, Map<String, String> form, Map<String, String> headers) {
        return new OAuth2Request("POST", URI.create(url), form, headers);
    }

    public boolean isPost() {
        return "POST".equals(method);
    }

    /** Query string parameters. */
    public Map<String, String> args() {
        Map<String, String> args = new LinkedHashMap<>();
        String query = uri.getRawQuery();
        if (query == null || query.isEmpty()) return args;
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) continue;
            int idx = pair.indexOf('=');
            String name = idx < 0 ? pair : pair.substring(0, idx);
            String value = idx < 0 ? "" : pair.substring(idx + 1);
            args.putIfAbsent(decode(name), decode(value));
        }
        return args;
    }

    /** Query and form parameters merged; form values win. */
    public Map<String, String> data() {
        Map<String, String> data = args();
        data.putAll(form);
        return data;
    }

    public String param(String name) {
        String value = data().get(name);
        return value == null || value.isEmpty() ? null : value;
    }

    public String formParam(String name) {
        String value = form.get(name);
        return value == null || value.isEmpty() ? null : value;
    }

    public String header(String name) {
        return headers.get(name);
    }

    public String clientId() {
        return param("client_id");
    }

    public String responseType() {
        return param("response_type");
    }

    public String grantType() {
        return formParam("grant_type");
    }

    public String redirectUri() {
        return param("redirect_uri");
    }

    public String scope() {
        return param("scope");
    }

    public String state() {
        return param("state");
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }
}
