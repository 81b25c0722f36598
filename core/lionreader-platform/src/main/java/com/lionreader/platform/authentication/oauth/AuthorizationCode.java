package com.lionreader.platform.authentication.oauth;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A pending authorization code.
 *
 * Codes are single-use and short-lived. Only the SHA-256 hash of the code
 * is stored; the plain value exists only in the redirect to the client.
 */
public class AuthorizationCode {

    public String id;

    /**
     * SHA-256 hex of the code value.
     */
    public String codeHash;

    public String clientId;

    public String userId;

    /**
     * Redirect URI used in the authorization request. The token request
     * must present the same value.
     */
    public String redirectUri;

    public List<String> scopes = new ArrayList<>();

    /**
     * S256 challenge from the authorization request.
     */
    public String codeChallenge;

    public String codeChallengeMethod = PkceService.METHOD_S256;

    /**
     * RFC 8707 resource indicator, if the client sent one.
     */
    public String resource;

    public String state;

    public Instant createdAt = Instant.now();

    public Instant expiresAt;

    /**
     * When the code was exchanged. Null while unused.
     */
    public Instant usedAt;

    public boolean isExpired() {
        return !Instant.now().isBefore(expiresAt);
    }

    public boolean isUsed() {
        return usedAt != null;
    }

    public boolean isValid() {
        return !isUsed() && !isExpired();
    }
}
