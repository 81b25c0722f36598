package com.lionreader.platform.authentication.oauth;

import com.lionreader.platform.authentication.AuthConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Stateless checks on redirect URIs, scopes and response types.
 *
 * Redirect URIs are compared by exact string match; no normalization,
 * prefix or wildcard matching is applied.
 */
@ApplicationScoped
public class OAuthParameterValidator {

    public static final String RESPONSE_TYPE_CODE = "code";

    /**
     * Upper bound for redirect URIs, resource indicators and state, matching the stored column width.
     */
    public static final int MAX_PARAMETER_LENGTH = 2048;

    private static final Set<String> LOOPBACK_HOSTS = Set.of("localhost", "127.0.0.1", "[::1]");
    private static final Set<String> FORBIDDEN_SCHEMES = Set.of("javascript", "data", "file", "vbscript", "about", "blob");

    @Inject
    AuthConfig authConfig;

    /**
     * Absolute URI without fragment, using https, http on a loopback host,
     * or a native-app private-use scheme.
     */
    public boolean isValidRedirectUriFormat(String redirectUri) {
        if (redirectUri == null || redirectUri.isBlank() || redirectUri.length() > MAX_PARAMETER_LENGTH) {
            return false;
        }
        URI uri;
        try {
            uri = new URI(redirectUri);
        } catch (URISyntaxException e) {
            return false;
        }
        if (!uri.isAbsolute() || uri.getRawFragment() != null) {
            return false;
        }

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (FORBIDDEN_SCHEMES.contains(scheme)) {
            return false;
        }
        if ("https".equals(scheme)) {
            return uri.getHost() != null;
        }
        if ("http".equals(scheme)) {
            return uri.getHost() != null && LOOPBACK_HOSTS.contains(uri.getHost().toLowerCase(Locale.ROOT));
        }
        return isNativeScheme(scheme) && !uri.isOpaque();
    }

    /**
     * Exact, case-sensitive match against the registered set.
     */
    public boolean validateRedirectUri(String redirectUri, Collection<String> registeredUris) {
        if (redirectUri == null || registeredUris == null) {
            return false;
        }
        return registeredUris.contains(redirectUri);
    }

    /**
     * Split on whitespace, drop empties and duplicates, keep first-seen order.
     * A missing or blank value yields the default scope.
     */
    public List<String> parseScopes(String scope) {
        if (scope == null || scope.isBlank()) {
            return List.of(authConfig.oauth().defaultScope());
        }
        Set<String> scopes = new LinkedHashSet<>();
        for (String s : scope.trim().split("\\s+")) {
            if (!s.isEmpty()) {
                scopes.add(s);
            }
        }
        return new ArrayList<>(scopes);
    }

    /**
     * Requested scopes that are both supported by the server and allowed
     * for the client, in request order.
     */
    public List<String> validateScopes(List<String> requested, Collection<String> allowed) {
        List<String> supported = authConfig.oauth().supportedScopes();
        List<String> granted = new ArrayList<>();
        for (String scope : requested) {
            if (supported.contains(scope) && allowed.contains(scope) && !granted.contains(scope)) {
                granted.add(scope);
            }
        }
        return granted;
    }

    public boolean isSupportedScope(String scope) {
        return authConfig.oauth().supportedScopes().contains(scope);
    }

    public List<String> supportedScopes() {
        return authConfig.oauth().supportedScopes();
    }

    /**
     * RFC 8707 resource indicator: absolute URI without fragment, at most
     * {@link #MAX_PARAMETER_LENGTH} characters. Absent is valid.
     */
    public boolean isValidResource(String resource) {
        if (resource == null) {
            return true;
        }
        if (resource.length() > MAX_PARAMETER_LENGTH) {
            return false;
        }
        try {
            URI uri = new URI(resource);
            return uri.isAbsolute() && uri.getRawFragment() == null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    /**
     * Opaque client state is echoed back verbatim; only its length is bounded.
     */
    public boolean isValidState(String state) {
        return state == null || state.length() <= MAX_PARAMETER_LENGTH;
    }

    public boolean isSupportedResponseType(String responseType) {
        return RESPONSE_TYPE_CODE.equals(responseType);
    }

    // RFC 8252 Section 7.1: reverse-domain private-use schemes contain a dot
    private boolean isNativeScheme(String scheme) {
        if (scheme.contains(".")) {
            return true;
        }
        return authConfig.oauth().nativeRedirectSchemes()
            .map(schemes -> schemes.stream().anyMatch(s -> s.equalsIgnoreCase(scheme)))
            .orElse(false);
    }
}
