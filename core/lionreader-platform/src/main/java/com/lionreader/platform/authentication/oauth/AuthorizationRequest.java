package com.lionreader.platform.authentication.oauth;

/**
 * Parameters of GET /oauth/authorize, as received.
 */
public record AuthorizationRequest(
    String responseType,
    String clientId,
    String redirectUri,
    String scope,
    String state,
    String codeChallenge,
    String codeChallengeMethod,
    String resource
) {
}
