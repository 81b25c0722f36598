package com.lionreader.platform.authentication.oauth;

import java.util.List;

/**
 * Access and refresh token issued together.
 *
 * @param expiresIn access token lifetime in seconds
 */
public record TokenPair(
    String accessToken,
    String refreshToken,
    long expiresIn,
    List<String> scopes
) {

    public static final String TOKEN_TYPE = "bearer";

    public String scope() {
        return String.join(" ", scopes);
    }
}
