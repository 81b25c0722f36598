package com.lionreader.platform.authentication.oauth;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A rotating refresh token.
 *
 * Features:
 * - Rotation: each use marks the token used and issues a replacement
 * - Family tracking: presenting an already-used token revokes the whole family
 *
 * Only the token hash is stored.
 */
public class RefreshToken {

    public String id;

    public String tokenHash;

    public String clientId;

    public String userId;

    public List<String> scopes = new ArrayList<>();

    public String resource;

    /**
     * All tokens descended from the same authorization code share a family.
     */
    public String tokenFamily;

    public Instant createdAt = Instant.now();

    public Instant expiresAt;

    /**
     * Set when the token is rotated. Null while the token is live.
     */
    public Instant usedAt;

    public Instant revokedAt;

    /**
     * Id of the refresh token issued on rotation.
     */
    public String replacedBy;

    public boolean isUsed() {
        return usedAt != null;
    }

    public boolean isValid() {
        return usedAt == null && revokedAt == null && Instant.now().isBefore(expiresAt);
    }
}
