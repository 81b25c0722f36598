package com.lionreader.platform.authentication.oauth;

import java.util.List;

/**
 * The authorization carried by a valid access token.
 */
public record AccessTokenInfo(
    String userId,
    String clientId,
    List<String> scopes,
    String resource
) {

    public boolean hasScope(String scope) {
        return scopes.contains(scope);
    }
}
