package com.lionreader.platform.authentication.oauth;

/**
 * Form submitted by the consent page to POST /oauth/authorize.
 *
 * @param action "approve" or "deny"
 */
public record ConsentDecision(
    String clientId,
    String redirectUri,
    String scope,
    String state,
    String codeChallenge,
    String codeChallengeMethod,
    String resource,
    String action
) {

    public static final String APPROVE = "approve";
    public static final String DENY = "deny";
}
