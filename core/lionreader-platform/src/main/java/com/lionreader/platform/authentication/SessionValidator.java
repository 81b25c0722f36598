package com.lionreader.platform.authentication;

import java.util.Optional;

/**
 * Resolves a browser session token to the authenticated user.
 *
 * Sessions are created and revoked by the login system; the authorization
 * server only reads them.
 */
public interface SessionValidator {

    /**
     * @return the user id, or empty when the token is unknown, expired or revoked
     */
    Optional<String> validateSession(String sessionToken);
}
