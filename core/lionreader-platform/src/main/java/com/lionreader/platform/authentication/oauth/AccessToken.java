package com.lionreader.platform.authentication.oauth;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * An opaque bearer access token. Only the hash is stored.
 */
public class AccessToken {

    public String id;

    public String tokenHash;

    public String clientId;

    public String userId;

    public List<String> scopes = new ArrayList<>();

    public String resource;

    /**
     * Family shared with the refresh token issued alongside, so reuse
     * detection can revoke both.
     */
    public String tokenFamily;

    public Instant createdAt = Instant.now();

    public Instant expiresAt;

    public Instant revokedAt;

    public Instant lastUsedAt;

    public boolean isValid() {
        return revokedAt == null && Instant.now().isBefore(expiresAt);
    }
}
