package com.lionreader.platform.authentication.oauth.mapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Scopes are stored as a single space-delimited column.
 */
final class ScopeCodec {

    private ScopeCodec() {
    }

    static String join(List<String> scopes) {
        return scopes == null ? "" : String.join(" ", scopes);
    }

    static List<String> split(String scope) {
        if (scope == null || scope.isBlank()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(scope.trim().split("\\s+")));
    }
}
