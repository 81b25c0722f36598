package com.lionreader.platform.authentication.oauth;

import java.util.List;

/**
 * Result of running an authorization request through {@link AuthorizationFlow}.
 */
public sealed interface AuthorizationOutcome {

    AuthorizationStage stage();

    /**
     * Error shown to the user agent as JSON. Used while the redirect URI is
     * not yet trusted, and for an unauthenticated consent submission.
     */
    record DirectError(int status, OAuthError error, String description) implements AuthorizationOutcome {
        @Override
        public AuthorizationStage stage() {
            return AuthorizationStage.START;
        }
    }

    /**
     * Error delivered to the client's verified redirect URI.
     */
    record RedirectError(
        AuthorizationStage stage,
        String redirectUri,
        OAuthError error,
        String description,
        String state
    ) implements AuthorizationOutcome {
    }

    /**
     * No valid session; the user must log in and come back.
     */
    record LoginRequired() implements AuthorizationOutcome {
        @Override
        public AuthorizationStage stage() {
            return AuthorizationStage.VALIDATED;
        }
    }

    /**
     * The user has not approved these scopes for this client yet.
     */
    record ConsentRequired(
        OAuthClient client,
        String redirectUri,
        List<String> scopes,
        String codeChallenge,
        String state,
        String resource
    ) implements AuthorizationOutcome {
        @Override
        public AuthorizationStage stage() {
            return AuthorizationStage.AUTHENTICATED;
        }

        public String scope() {
            return String.join(" ", scopes);
        }
    }

    record CodeIssued(String redirectUri, String code, String state) implements AuthorizationOutcome {
        @Override
        public AuthorizationStage stage() {
            return AuthorizationStage.CODE_ISSUED;
        }
    }
}
