package com.lionreader.platform.authentication.oauth.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;

/**
 * JPA entity for oauth_consent_grants table.
 */
@Entity
@Table(name = "oauth_consent_grants",
    uniqueConstraints = @UniqueConstraint(name = "uq_oauth_consent_user_client", columnNames = {"user_id", "client_id"}))
public class ConsentGrantEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "user_id", nullable = false, length = 36)
    public String userId;

    @Column(name = "client_id", nullable = false, length = 64)
    public String clientId;

    @Column(name = "scope", nullable = false, length = 500)
    public String scope;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    @Column(name = "revoked_at")
    public Instant revokedAt;

    public ConsentGrantEntity() {
    }
}
