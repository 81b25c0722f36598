package com.lionreader.platform.authentication.oauth.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity for oauth_clients table.
 */
@Entity
@Table(name = "oauth_clients")
public class OAuthClientEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "client_id", nullable = false, unique = true, length = 64)
    public String clientId;

    @Column(name = "client_name", nullable = false, length = 200)
    public String clientName;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "oauth_client_redirect_uris", joinColumns = @JoinColumn(name = "oauth_client_id"))
    @OrderColumn(name = "list_index")
    @Column(name = "redirect_uri", length = 2048)
    public List<String> redirectUris = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "oauth_client_scopes", joinColumns = @JoinColumn(name = "oauth_client_id"))
    @OrderColumn(name = "list_index")
    @Column(name = "scope", length = 100)
    public List<String> scopes = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public OAuthClientEntity() {
    }
}
