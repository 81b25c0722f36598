package com.lionreader.platform.authentication.oauth.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for oauth_refresh_tokens table.
 */
@Entity
@Table(name = "oauth_refresh_tokens")
public class RefreshTokenEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "token_hash", nullable = false, unique = true, length = 64)
    public String tokenHash;

    @Column(name = "client_id", nullable = false, length = 64)
    public String clientId;

    @Column(name = "user_id", nullable = false, length = 36)
    public String userId;

    @Column(name = "scope", nullable = false, length = 500)
    public String scope;

    @Column(name = "resource", length = 2048)
    public String resource;

    @Column(name = "token_family", nullable = false, length = 17)
    public String tokenFamily;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    @Column(name = "used_at")
    public Instant usedAt;

    @Column(name = "revoked_at")
    public Instant revokedAt;

    @Column(name = "replaced_by", length = 17)
    public String replacedBy;

    public RefreshTokenEntity() {
    }
}
