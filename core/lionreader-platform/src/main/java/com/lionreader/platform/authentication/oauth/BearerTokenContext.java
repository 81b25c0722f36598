package com.lionreader.platform.authentication.oauth;

import jakarta.enterprise.context.RequestScoped;

/**
 * Holds the access token that authenticated the current request.
 */
@RequestScoped
public class BearerTokenContext {

    private AccessTokenInfo token;

    public AccessTokenInfo token() {
        if (token == null) {
            throw new IllegalStateException("No bearer token on this request");
        }
        return token;
    }

    void authenticate(AccessTokenInfo token) {
        this.token = token;
    }
}
