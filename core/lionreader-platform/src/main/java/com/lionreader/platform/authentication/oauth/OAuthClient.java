package com.lionreader.platform.authentication.oauth;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A registered public OAuth client (MCP client, native app, SPA).
 *
 * Clients never hold a secret; possession of the authorization code is
 * bound to the client through PKCE instead.
 */
public class OAuthClient {

    /**
     * Internal TSID primary key (oac_...).
     */
    public String id;

    /**
     * Opaque public identifier sent as client_id.
     */
    public String clientId;

    /**
     * Display name shown on the consent page.
     */
    public String clientName;

    /**
     * Registered redirect URIs. Requests must match one exactly.
     */
    public List<String> redirectUris = new ArrayList<>();

    /**
     * Scopes this client may request.
     */
    public List<String> scopes = new ArrayList<>();

    public Instant createdAt = Instant.now();
}
