package com.lionreader.platform.authentication.oauth;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * A user's standing approval for a client. One per (user, client) pair;
 * scopes only grow until the grant is revoked.
 */
public class ConsentGrant {

    public String id;

    public String userId;

    public String clientId;

    public List<String> scopes = new ArrayList<>();

    public Instant createdAt = Instant.now();

    public Instant updatedAt = Instant.now();

    public Instant revokedAt;

    public boolean isActive() {
        return revokedAt == null;
    }

    /**
     * True when the grant is active and contains every requested scope.
     */
    public boolean covers(Collection<String> requested) {
        return isActive() && scopes.containsAll(requested);
    }
}
