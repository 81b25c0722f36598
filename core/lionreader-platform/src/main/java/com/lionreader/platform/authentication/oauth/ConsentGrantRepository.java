package com.lionreader.platform.authentication.oauth;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for consent grants.
 */
public interface ConsentGrantRepository {

    // Read operations
    Optional<ConsentGrant> findByUserAndClient(String userId, String clientId);
    List<ConsentGrant> findActiveByUser(String userId);

    /**
     * Same as {@link #findByUserAndClient} but holds a write lock on the row
     * until the transaction ends.
     */
    Optional<ConsentGrant> findByUserAndClientForUpdate(String userId, String clientId);

    // Write operations
    void persist(ConsentGrant grant);
    void update(ConsentGrant grant);
    boolean revoke(String userId, String clientId, Instant now);
}
