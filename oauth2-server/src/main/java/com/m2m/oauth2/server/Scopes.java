package com.m2m.oauth2.server;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * RFC 6749 section 3.3 scope strings.
 */
public final class Scopes {
    // scope-token = 1*( %x21 / %x23-5B / %x5D-7E )
    private static final Pattern SCOPE =
        Pattern.compile("[\\x21\\x23-\\x5B\\x5D-\\x7E]+( [\\x21\\x23-\\x5B\\x5D-\\x7E]+)*");

    private Scopes() {}

    public static boolean isWellFormed(String scope) {
        return scope != null && SCOPE.matcher(scope).matches();
    }

    public static Set<String> split(String scope) {
        if (scope == null || scope.isBlank()) return Set.of();
        return Arrays.stream(scope.trim().split(" +")).collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
