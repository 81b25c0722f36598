package com.lionreader.platform.authentication.oauth.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for oauth_authorization_codes table.
 */
@Entity
@Table(name = "oauth_authorization_codes")
public class AuthorizationCodeEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "code_hash", nullable = false, unique = true, length = 64)
    public String codeHash;

    @Column(name = "client_id", nullable = false, length = 64)
    public String clientId;

    @Column(name = "user_id", nullable = false, length = 36)
    public String userId;

    @Column(name = "redirect_uri", nullable = false, length = 2048)
    public String redirectUri;

    @Column(name = "scope", nullable = false, length = 500)
    public String scope;

    @Column(name = "code_challenge", nullable = false, length = 128)
    public String codeChallenge;

    @Column(name = "code_challenge_method", nullable = false, length = 10)
    public String codeChallengeMethod;

    @Column(name = "resource", length = 2048)
    public String resource;

    @Column(name = "state", length = 2048)
    public String state;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    @Column(name = "used_at")
    public Instant usedAt;

    public AuthorizationCodeEntity() {
    }
}
