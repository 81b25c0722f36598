package com.lionreader.platform.authentication.oauth;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OAuth error codes returned by the authorization server.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc6749#section-5.2">RFC 6749 Section 5.2</a>
 */
public enum OAuthError {

    INVALID_REQUEST("invalid_request"),
    INVALID_CLIENT("invalid_client"),
    INVALID_GRANT("invalid_grant"),
    INVALID_SCOPE("invalid_scope"),
    UNSUPPORTED_GRANT_TYPE("unsupported_grant_type"),
    UNSUPPORTED_RESPONSE_TYPE("unsupported_response_type"),
    ACCESS_DENIED("access_denied"),
    INVALID_TOKEN("invalid_token"),
    INVALID_CLIENT_METADATA("invalid_client_metadata"),
    INVALID_REDIRECT_URI("invalid_redirect_uri"),
    SERVER_ERROR("server_error"),
    TEMPORARILY_UNAVAILABLE("temporarily_unavailable");

    private final String code;

    OAuthError(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * JSON error body: {"error": ..., "error_description": ...}.
     */
    public Map<String, String> body(String description) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", code);
        if (description != null) {
            body.put("error_description", description);
        }
        return body;
    }
}
