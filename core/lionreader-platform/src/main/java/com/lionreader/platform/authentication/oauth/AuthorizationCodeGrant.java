package com.lionreader.platform.authentication.oauth;

import java.util.List;

/**
 * What a successfully consumed authorization code grants.
 */
public record AuthorizationCodeGrant(
    String userId,
    String clientId,
    List<String> scopes,
    String resource
) {
}
