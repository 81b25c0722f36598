package com.lionreader.platform.authentication.oauth;

/**
 * Stages of an authorization request, in order. A request leaves the flow
 * at the stage it last reached.
 */
public enum AuthorizationStage {
    /** Parameters not yet trusted; errors cannot be redirected. */
    START,
    /** Client and redirect URI verified; errors go back to the client. */
    VALIDATED,
    /** A user session is attached. */
    AUTHENTICATED,
    /** The user has approved the requested scopes. */
    CONSENTED,
    CODE_ISSUED
}
